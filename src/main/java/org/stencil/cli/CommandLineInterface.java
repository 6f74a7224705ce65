package org.stencil.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stencil.cli.commands.CompileCommand;
import org.stencil.config.ConfigLoader;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "stencil",
    mixinStandardHelpOptions = true,
    version = "Stencil 1.0",
    description = "Stencil - compile-time template preprocessor",
    subcommands = {
        CompileCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: stencil.conf)"
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
     * @return The configured command line, shared by {@link #main} and tests.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("stencil");
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof ConfigException || ex instanceof IllegalArgumentException) {
                LOG.error("Invalid configuration: {}", ex.getMessage());
                return 2;
            }
            throw ex;
        });
        return commandLine;
    }

    /**
     * Loads the configuration on first use.
     * @return The resolved configuration.
     * @throws ConfigException if a configuration file cannot be parsed.
     * @throws IllegalArgumentException if the {@code --config} file does not exist.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
        }
        return config;
    }
}
