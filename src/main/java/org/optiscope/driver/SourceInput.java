package org.optiscope.driver;

/**
 * Source text together with the name diagnostics refer to it by.
 *
 * @param name The file name, or {@code <stdin>}.
 * @param text The source text.
 */
public record SourceInput(String name, String text) {
}
