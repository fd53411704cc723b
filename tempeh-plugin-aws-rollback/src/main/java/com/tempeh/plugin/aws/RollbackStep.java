package com.tempeh.plugin.aws;

import java.util.Objects;

/** One step of a rollback strategy, with its expected duration. */
public final class RollbackStep {

    private final String name;
    private final String type;
    private final long durationMillis;

    public RollbackStep(String name, String type, long durationMillis) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.durationMillis = durationMillis;
    }

    public String getName() { return name; }
    public String getType() { return type; }
    public long getDurationMillis() { return durationMillis; }

    @Override
    public String toString() {
        return name + "(" + type + ")";
    }
}
