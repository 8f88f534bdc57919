package org.optiscope.driver;

/**
 * A broken precondition of the driver itself. The session cannot continue safely and is terminated.
 */
public class InvariantViolationException extends IllegalStateException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
