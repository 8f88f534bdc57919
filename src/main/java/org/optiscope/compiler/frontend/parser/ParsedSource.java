package org.optiscope.compiler.frontend.parser;

import org.optiscope.compiler.object.ObjectNode;

/**
 * The result of parsing an input.
 *
 * @param root           The root object.
 * @param codeBlockInput True if the input was a bare code block rather than object notation.
 *                       Such input is wrapped into an object named {@value ObjectParser#DEFAULT_OBJECT_NAME}.
 */
public record ParsedSource(ObjectNode root, boolean codeBlockInput) {
}
