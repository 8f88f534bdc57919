package org.optiscope.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the log levels of the {@code logging} configuration block to Logback.
 * <pre>
 * logging {
 *   default-level = "WARN"
 *   levels { "org.optiscope.driver" = "DEBUG" }
 * }
 * </pre>
 * Unknown level names fall back to DEBUG, which is Logback's own behavior for
 * {@link Level#toLevel(String)}.
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    public static void configure(final Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        if (config.hasPath("logging.default-level")) {
            context.getLogger(Logger.ROOT_LOGGER_NAME)
                .setLevel(Level.toLevel(config.getString("logging.default-level")));
        }
        if (config.hasPath("logging.levels")) {
            final ConfigObject levels = config.getObject("logging.levels");
            for (Map.Entry<String, ConfigValue> entry : levels.entrySet()) {
                final String level = String.valueOf(entry.getValue().unwrapped());
                context.getLogger(entry.getKey()).setLevel(Level.toLevel(level));
            }
        }
    }
}
