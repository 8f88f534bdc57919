package org.optiscope.compiler.frontend.semantics;

/**
 * Where in the control structure the analyzer currently is. Decides whether
 * {@code break}, {@code continue}, {@code leave} and function definitions are allowed.
 */
public enum ControlContext {
    TOP_LEVEL,
    FUNCTION,
    LOOP_INIT,
    LOOP_POST,
    LOOP_BODY
}
