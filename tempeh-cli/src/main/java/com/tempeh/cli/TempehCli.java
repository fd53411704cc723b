package com.tempeh.cli;

import com.tempeh.config.TempehConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * Entry point of the {@code tempeh} command line. Only the {@code plugin} command group is provided here.
 * Exit codes: 0 success, 1 command failure, 2 usage error.
 *
 * @see PluginCommand
 */
@Command(
        name = "tempeh",
        mixinStandardHelpOptions = true,
        version = "tempeh 0.1.0",
        description = "Tempeh infrastructure workflow CLI")
public final class TempehCli implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TempehCli.class);

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        throw new ParameterException(spec.commandLine(), "Missing required subcommand");
    }

    public static void main(String[] args) {
        System.exit(newCommandLine(TempehConfig.fromEnvironment()).execute(args));
    }

    /** Command line for the given configuration; output goes to the writers set on the returned instance. */
    public static CommandLine newCommandLine(TempehConfig config) {
        CommandLine cli = new CommandLine(new TempehCli());
        cli.addSubcommand("plugin", new PluginCommand(config));
        cli.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            log.debug("Command failed", ex);
            commandLine.getErr().println("Error: " + ex.getMessage());
            return 1;
        });
        return cli;
    }
}
