package org.querylex.cli;

import com.typesafe.config.Config;
import org.querylex.cli.commands.TokenizeCommand;
import org.querylex.config.ConfigLoader;
import org.querylex.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "querylex",
    mixinStandardHelpOptions = true,
    version = "querylex 1.0",
    description = "Scans SQL2 query statements into tokens",
    subcommands = {
        TokenizeCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * @return A command line for a fresh interface, accepting enum values in any case.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("querylex");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     * @return The merged application configuration.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
