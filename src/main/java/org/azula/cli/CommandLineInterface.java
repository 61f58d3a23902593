package org.azula.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.azula.cli.commands.TokenizeCommand;
import org.azula.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "azula",
    mixinStandardHelpOptions = true,
    version = "Azula Lexer 0.1.0",
    description = "Developer tooling for the Azula compiler front-end.",
    subcommands = {
        TokenizeCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);
    private static final String CONFIG_FILE_NAME = "azula.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("azula");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        // Config load order: System Props > Env Vars > File > Classpath defaults
        final File file = resolveConfigFile();
        final Config fileConfig;
        if (file != null) {
            LOG.info("Using configuration file: {}", file.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(file);
        } else {
            LOG.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
            fileConfig = ConfigFactory.empty();
        }
        this.config = ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.load())
                .resolve();

        LoggingConfigurator.configure(config);
        initialized = true;
    }

    private File resolveConfigFile() {
        // 1) Highest precedence: explicit CLI option --config
        if (configFile != null) {
            if (!configFile.isFile()) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
            }
            return configFile;
        }
        // 2) Then: azula.conf in the current working directory
        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        return cwdConfigFile.isFile() ? cwdConfigFile : null;
    }

    /**
     * Returns the merged configuration, loading it on first access.
     *
     * @return The resolved configuration.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
