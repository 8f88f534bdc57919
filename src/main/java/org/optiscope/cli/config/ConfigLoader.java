package org.optiscope.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.net.URISyntaxException;
import java.security.CodeSource;
import java.util.Optional;

/**
 * Locates and loads the HOCON configuration of the command line tool.
 * <p>
 * Precedence, highest first: Java system properties, environment variables, the selected
 * configuration file, {@code reference.conf} from the classpath. Substitutions are resolved
 * only after all layers are stacked, so a file may override a value that a default refers to.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "optiscope.conf";

    private ConfigLoader() {
    }

    /**
     * Severity of a resolution message.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is being selected.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {
        void log(MessageLevel level, String message);
    }

    /**
     * Selects the configuration file and loads it. The first match wins:
     * <ol>
     *   <li>the file given with {@code --config},</li>
     *   <li>the file named by {@code -Dconfig.file},</li>
     *   <li>{@code config/optiscope.conf} in the working directory,</li>
     *   <li>{@code config/optiscope.conf} next to the {@code lib} directory holding the jar,</li>
     *   <li>no file, classpath defaults only.</li>
     * </ol>
     *
     * @param explicitConfigFile The file from the command line, or {@code null}.
     * @param handler            Receives the selection messages.
     * @return The resolved configuration.
     * @throws IllegalArgumentException              if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            requireExists(explicitConfigFile, "Configuration file not found: ");
            handler.log(MessageLevel.INFO, "Using configuration file " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        final String property = System.getProperty("config.file");
        if (property != null && !property.isBlank()) {
            final File file = new File(property).getAbsoluteFile();
            requireExists(file, "Configuration file named by -Dconfig.file not found: ");
            handler.log(MessageLevel.INFO, "Using configuration file from -Dconfig.file: " + file);
            return loadFromFile(file);
        }

        final File workingDirectoryFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (workingDirectoryFile.isFile()) {
            handler.log(MessageLevel.INFO, "Using configuration file " + workingDirectoryFile.getAbsolutePath());
            return loadFromFile(workingDirectoryFile);
        }

        final Optional<File> installed = installationConfigFile();
        if (installed.isPresent()) {
            handler.log(MessageLevel.INFO, "Using installed configuration file " + installed.get());
            return loadFromFile(installed.get());
        }

        handler.log(MessageLevel.WARN, "No " + CONFIG_DIR + "/" + CONFIG_FILE_NAME + " found, using built-in defaults.");
        return loadDefaults();
    }

    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    private static void requireExists(final File file, final String message) {
        if (!file.exists()) {
            throw new IllegalArgumentException(message + file.getAbsolutePath());
        }
    }

    /**
     * Looks for {@code APP_HOME/config/optiscope.conf}, where the running jar sits in
     * {@code APP_HOME/lib}. Running from a classes directory never matches.
     */
    private static Optional<File> installationConfigFile() {
        final CodeSource codeSource = ConfigLoader.class.getProtectionDomain().getCodeSource();
        if (codeSource == null || codeSource.getLocation() == null) {
            return Optional.empty();
        }
        final File jar;
        try {
            jar = new File(codeSource.getLocation().toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            // not a file URL, e.g. a nested jar
            return Optional.empty();
        }
        if (!jar.isFile() || jar.getParentFile() == null || jar.getParentFile().getParentFile() == null) {
            return Optional.empty();
        }
        final File candidate = new File(new File(jar.getParentFile().getParentFile(), CONFIG_DIR), CONFIG_FILE_NAME);
        return candidate.isFile() ? Optional.of(candidate) : Optional.empty();
    }
}
