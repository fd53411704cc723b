package com.tempeh.plugin.aws;

import com.tempeh.plugin.Plugin;
import com.tempeh.plugin.PluginProvider;

/**
 * Provider for the built-in AWS rollback plugin. Its manifest ships on the classpath as
 * {@code META-INF/tempeh/plugins/aws-rollback/plugin.json}.
 */
public final class AwsRollbackPluginProvider implements PluginProvider {

    public static final String ENTRY_POINT = "aws-rollback";
    public static final String CLASSPATH_NAME = "aws-rollback";

    @Override
    public String getEntryPoint() {
        return ENTRY_POINT;
    }

    @Override
    public Plugin createPlugin() {
        return new AwsRollbackPlugin();
    }
}
