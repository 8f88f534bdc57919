package org.optiscope.driver;

/**
 * Bad or missing input: unreadable source, unresolvable object path, malformed step sequence
 * or invalid settings. Always reported before the tree is touched.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
