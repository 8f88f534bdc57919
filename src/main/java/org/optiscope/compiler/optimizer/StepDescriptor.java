package org.optiscope.compiler.optimizer;

/**
 * Registry entry for a step.
 *
 * @param abbreviation           The single-character code.
 * @param name                   The human-readable name shown in menus.
 * @param requiresDisambiguation True if the step relies on all identifiers being unique.
 * @param step                   The transformation.
 */
public record StepDescriptor(char abbreviation, String name, boolean requiresDisambiguation, IOptimiserStep step) {
}
