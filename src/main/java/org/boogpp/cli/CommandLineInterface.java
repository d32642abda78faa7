package org.boogpp.cli;

import com.typesafe.config.ConfigException;
import org.boogpp.cli.commands.CheckCommand;
import org.boogpp.cli.commands.CompileCommand;
import org.boogpp.compiler.config.CompilerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "boogpp",
    mixinStandardHelpOptions = true,
    version = "Boog++ compiler 0.1",
    description = "Boog++ compiler - compiles Boog++ sources to IR for the native backend",
    subcommands = {
        CompileCommand.class,
        CheckCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: boogpp.conf)"
    )
    private File configFile;

    private CompilerConfig config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        System.exit(newCommandLine(new CommandLineInterface()).execute(args));
    }

    /**
     * Creates a command line with the parser settings all commands share.
     * @param command The root command object.
     * @return The configured command line.
     */
    public static CommandLine newCommandLine(Object command) {
        CommandLine commandLine = new CommandLine(command);
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return The compiler configuration.
     * @throws ConfigException if the configuration file named by {@code --config} is missing or
     *                         a value is malformed.
     */
    public CompilerConfig getConfig() {
        if (config == null) {
            if (configFile != null && !configFile.isFile()) {
                throw new ConfigException.IO(null, "Configuration file specified via --config was not found: "
                        + configFile.getAbsolutePath());
            }
            config = configFile != null ? CompilerConfig.load(configFile) : CompilerConfig.load();
            LOG.debug("Configuration loaded; default safety mode {}", config.defaultMode());
            LoggingConfigurator.configure(config.raw());
        }
        return config;
    }
}
