package com.tempeh.plugin.loader;

import com.tempeh.plugin.PluginContext;
import com.tempeh.plugin.PluginDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;

final class DefaultPluginContext implements PluginContext {

    private final PluginDescriptor descriptor;
    private final Path workingDirectory;
    private final Logger logger;

    DefaultPluginContext(PluginDescriptor descriptor, Path workingDirectory) {
        this.descriptor = descriptor;
        this.workingDirectory = workingDirectory;
        this.logger = LoggerFactory.getLogger("tempeh.plugin." + descriptor.getId());
    }

    @Override
    public PluginDescriptor getDescriptor() {
        return descriptor;
    }

    @Override
    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    @Override
    public Map<String, Object> getConfiguration() {
        return descriptor.getConfiguration();
    }

    @Override
    public Logger getLogger() {
        return logger;
    }
}
