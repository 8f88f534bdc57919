package org.optiscope.cli;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

import org.optiscope.cli.commands.ExploreCommand;
import org.optiscope.cli.commands.StepsCommand;
import org.optiscope.cli.config.ConfigLoader;
import org.optiscope.cli.config.LoggingConfigurator;
import org.optiscope.driver.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "optiscope",
    mixinStandardHelpOptions = true,
    version = "optiscope 1.0",
    description = "optiscope - step-by-step exploration of optimizer transformations on IR objects",
    subcommands = {
        ExploreCommand.class,
        StepsCommand.class,
        CommandLine.HelpCommand.class
    },
    footer = {
        "",
        "Configuration:",
        "  Defaults are read from config/optiscope.conf if present. Use -c to pick another file",
        "  or override single values with -D, for example:",
        "",
        "    java -Doptiscope.menu-columns=2 -jar optiscope.jar explore input.yul"
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/optiscope.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // No subcommand: show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("optiscope");
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        try {
            this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
                // running without a config file is the normal case for this tool
                switch (level) {
                    case INFO -> logger.debug(message);
                    case WARN -> logger.info(message);
                }
            });
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        } catch (ConfigException e) {
            throw new ConfigurationException("Failed to load or parse configuration: " + e.getMessage(), e);
        }

        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty("optiscope.logging.format", "PLAIN".equalsIgnoreCase(format) ? "STDERR_PLAIN" : "STDERR");
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);

        initialized = true;
    }

    private void reconfigureLogback() {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        try {
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            final URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
            if (configUrl != null) {
                configurator.doConfigure(configUrl);
            }
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    /**
     * @return The resolved configuration, loaded on first use.
     * @throws ConfigurationException if the configuration file is missing or malformed.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
