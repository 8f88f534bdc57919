package org.optiscope.driver;

/**
 * The two fixed utilities that live outside the step registry.
 */
public enum UtilityKind {
    VAR_NAME_CLEANER("VarNameCleaner"),
    STACK_COMPRESSOR("StackCompressor");

    private final String displayName;

    UtilityKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
