package org.optiscope.driver;

/**
 * Thrown for a step or control code that is not registered.
 */
public class UnknownStepException extends RuntimeException {

    private final char code;

    public UnknownStepException(char code) {
        super("Unknown step code '" + printable(code) + "'");
        this.code = code;
    }

    public char getCode() {
        return code;
    }

    private static String printable(char c) {
        return c < 0x20 || c > 0x7e ? String.format("\\x%02x", (int) c) : String.valueOf(c);
    }
}
