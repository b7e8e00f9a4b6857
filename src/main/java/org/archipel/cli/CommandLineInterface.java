package org.archipel.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.archipel.cli.commands.LeaderCommand;
import org.archipel.cli.commands.RunCommand;
import org.archipel.cli.commands.WorkerCommand;
import org.archipel.node.config.ConfigLoader;
import org.archipel.node.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "archipel",
    mixinStandardHelpOptions = true,
    version = "Archipel 1.0",
    description = "Runs island model evolutionary algorithms, locally or across nodes.",
    subcommands = {
        RunCommand.class,
        LeaderCommand.class,
        WorkerCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: archipel.conf)"
    )
    private File configFile;

    private Config config;

    /**
     * Without a subcommand there is nothing to do: print the usage and fail.
     */
    @Override
    public Integer call() {
        spec.commandLine().getErr().println("Missing command, expected one of: run, leader, worker");
        spec.commandLine().usage(spec.commandLine().getErr());
        return CommandLine.ExitCode.USAGE;
    }

    public static void main(final String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * Creates the command line with its error handling: failures inside a command are
     * reported as a single line on stderr and exit with code 1.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("archipel");
        commandLine.setExecutionExceptionHandler((exception, cmd, parseResult) -> {
            cmd.getErr().println("Error: " + exception.getMessage());
            return CommandLine.ExitCode.SOFTWARE;
        });
        return commandLine;
    }

    /**
     * Loads the configuration once and applies its logging section.
     *
     * @return The application configuration.
     * @throws IllegalArgumentException if an explicit configuration file is missing or invalid.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        if (configFile != null && !configFile.isFile()) {
            throw new IllegalArgumentException("Configuration file specified via --config was not found: "
                + configFile.getAbsolutePath());
        }
        try {
            config = configFile != null ? ConfigLoader.load(configFile) : ConfigLoader.load();
        } catch (final ConfigException e) {
            throw new IllegalArgumentException("Failed to load configuration: " + e.getMessage(), e);
        }
        LoggingConfigurator.configure(config);
        return config;
    }
}
