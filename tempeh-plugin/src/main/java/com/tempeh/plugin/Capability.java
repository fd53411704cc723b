package com.tempeh.plugin;

import java.util.Objects;

/**
 * A {@code (type, name)} pair a plugin declares. Indexed under {@link #key()} = {@code type:name}; the type
 * never contains a colon, so every key has exactly one split.
 */
public final class Capability {

    private final String type;
    private final String name;

    /**
     * @throws IllegalArgumentException if either part is blank or the type contains a colon
     */
    public Capability(String type, String name) {
        this.type = requireNonBlank(type, "type");
        this.name = requireNonBlank(name, "name");
        if (this.type.indexOf(':') >= 0) {
            throw new IllegalArgumentException("Capability type must not contain ':': " + this.type);
        }
    }

    /**
     * Parses {@code type:name}. The type ends at the first colon; the name may itself contain colons.
     *
     * @throws IllegalArgumentException if there is no colon or either side is blank
     */
    public static Capability parse(String key) {
        Objects.requireNonNull(key, "key");
        int idx = key.indexOf(':');
        if (idx <= 0 || idx == key.length() - 1) {
            throw new IllegalArgumentException("Capability key must be type:name: " + key);
        }
        return new Capability(key.substring(0, idx), key.substring(idx + 1));
    }

    public String getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public String key() {
        return type + ":" + name;
    }

    private static String requireNonBlank(String value, String field) {
        Objects.requireNonNull(value, field);
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Capability " + field + " must be non-blank");
        }
        return trimmed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Capability)) return false;
        Capability that = (Capability) o;
        return type.equals(that.type) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name);
    }

    @Override
    public String toString() {
        return key();
    }
}
