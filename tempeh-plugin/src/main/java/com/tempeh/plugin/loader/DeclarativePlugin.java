package com.tempeh.plugin.loader;

import com.tempeh.plugin.Plugin;
import com.tempeh.plugin.PluginContext;

/**
 * Stand-in for plugins that only declare capabilities and keywords. Activation does nothing.
 */
final class DeclarativePlugin implements Plugin {

    @Override
    public void activate(PluginContext context) {
        context.getLogger().debug("Declarative plugin {} has no entry point", context.getDescriptor().getId());
    }

    @Override
    public void deactivate() {
    }
}
