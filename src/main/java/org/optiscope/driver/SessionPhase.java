package org.optiscope.driver;

/**
 * States of the interactive controller.
 */
public enum SessionPhase {
    INITIAL,
    AWAITING_INPUT,
    APPLYING,
    VALIDATING,
    TERMINATED
}
