package org.optiscope.driver;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.optiscope.compiler.optimizer.OptimiserSettings;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Typed view of the {@code optiscope} configuration block.
 *
 * @param menuColumns         Number of columns of the step menu.
 * @param separator           Line printed between interactive steps.
 * @param reservedIdentifiers Names that no step may introduce.
 * @param optimiser           Sequence and stack compressor tuning.
 */
public record ExplorerSettings(int menuColumns, String separator, Set<String> reservedIdentifiers,
                               OptimiserSettings optimiser) {

    public static final String CONFIG_PATH = "optiscope";

    public ExplorerSettings {
        if (menuColumns < 1) {
            throw new ConfigurationException("optiscope.menu-columns must be at least 1, was " + menuColumns);
        }
        reservedIdentifiers = Set.copyOf(reservedIdentifiers);
    }

    /**
     * Reads the settings from a resolved configuration.
     * @param config The root configuration containing an {@code optiscope} block.
     * @return The settings.
     * @throws ConfigurationException if a value is missing or has the wrong type.
     */
    public static ExplorerSettings fromConfig(Config config) {
        try {
            Config c = config.getConfig(CONFIG_PATH);
            OptimiserSettings optimiser = new OptimiserSettings(
                    c.getInt("sequence.max-rounds"),
                    c.getInt("stack-compressor.max-iterations"),
                    c.getInt("stack-compressor.stack-limit"));
            return new ExplorerSettings(
                    c.getInt("menu-columns"),
                    c.getString("separator"),
                    new LinkedHashSet<>(c.getStringList("reserved-identifiers")),
                    optimiser);
        } catch (ConfigException | IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    /**
     * @return The settings of the bundled {@code reference.conf}.
     */
    public static ExplorerSettings defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }
}
