package org.nibble.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.nibble.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "nibble-asm",
    mixinStandardHelpOptions = true,
    version = "nibble-asm 1.0",
    description = "Assembler for the nibble machine: 16 registers, 15 opcodes, 64 bytes of instruction memory",
    subcommands = {
        AssembleCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    static final String CONFIG_FILE_NAME = "nibble.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: nibble.conf)"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("nibble-asm");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        try {
            // 1) Highest precedence: explicit CLI option --config
            if (this.configFile != null) {
                if (!this.configFile.exists()) {
                    throw configError("Configuration file specified via --config was not found: " + this.configFile.getAbsolutePath());
                }
                logger.info("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
                this.config = loadLayered(this.configFile);
            } else {
                // 2) Next: standard Typesafe Config system property -Dconfig.file
                final String systemConfigPath = System.getProperty("config.file");
                if (systemConfigPath != null && !systemConfigPath.isBlank()) {
                    final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
                    if (!systemConfigFile.exists()) {
                        throw configError("Configuration file specified via -Dconfig.file was not found: " + systemConfigFile.getAbsolutePath());
                    }
                    logger.info("Using configuration file specified via -Dconfig.file: {}", systemConfigFile.getAbsolutePath());
                    this.config = loadLayered(systemConfigFile);
                } else {
                    // 3) Then: nibble.conf in the current working directory
                    final File cwdConfigFile = new File(CONFIG_FILE_NAME);
                    if (cwdConfigFile.exists()) {
                        logger.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
                        this.config = loadLayered(cwdConfigFile);
                    } else {
                        // 4) Finally: classpath defaults only
                        logger.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
                        this.config = loadLayered(null);
                    }
                }
            }
            LoggingConfigurator.configure(this.config);
        } catch (ConfigException e) {
            throw configError("Failed to load or parse configuration: " + e.getMessage());
        }

        initialized = true;
    }

    // Load order: System Props > Env Vars > File > Classpath defaults
    private static Config loadLayered(final File file) {
        Config layered = ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment());
        if (file != null) {
            layered = layered.withFallback(ConfigFactory.parseFile(file));
        }
        return layered.withFallback(ConfigFactory.load()).resolve();
    }

    private RuntimeException configError(final String message) {
        if (spec != null) {
            return new CommandLine.ParameterException(spec.commandLine(), message);
        }
        return new IllegalStateException(message);
    }

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
