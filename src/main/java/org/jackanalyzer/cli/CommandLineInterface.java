package org.jackanalyzer.cli;

import com.typesafe.config.Config;
import org.jackanalyzer.cli.commands.AnalyzeCommand;
import org.jackanalyzer.config.ConfigLoader;
import org.jackanalyzer.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "jack-analyzer",
    mixinStandardHelpOptions = true,
    version = "Jack Analyzer 1.0",
    description = "Parses Jack classes and writes their parse trees as XML.",
    subcommands = {
        AnalyzeCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + " in the working directory)"
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
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("jack-analyzer");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     * @return The resolved configuration.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed.
     * @throws IllegalArgumentException if the file given with --config does not exist.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
