package org.pxboard.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.pxboard.cli.commands.node.NodeCommand;
import org.pxboard.node.config.ConfigLoader;
import org.pxboard.node.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "pxboard",
    mixinStandardHelpOptions = true,
    version = "pxboard 1.0",
    description = "Collaborative pixel board server",
    subcommands = {
        NodeCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: pxboard.conf in the working directory)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        System.exit(commandLine.execute(args));
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @throws CommandLine.ParameterException if the configuration cannot be loaded.
     */
    public synchronized Config getConfig(final CommandLine commandLine) {
        if (config == null) {
            try {
                config = configFile != null ? ConfigLoader.load(configFile) : ConfigLoader.load();
            } catch (final IllegalArgumentException | ConfigException e) {
                throw new CommandLine.ParameterException(commandLine, "Invalid configuration: " + e.getMessage(), e);
            }
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
