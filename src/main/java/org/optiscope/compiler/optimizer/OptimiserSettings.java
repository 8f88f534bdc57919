package org.optiscope.compiler.optimizer;

/**
 * Tuning values for step sequences and the stack compressor.
 *
 * @param maxRounds                    Upper bound for repeating a bracketed sequence part.
 * @param stackCompressorMaxIterations Upper bound for stack compression rounds.
 * @param stackLimit                   The number of simultaneously live variables a region may have.
 */
public record OptimiserSettings(int maxRounds, int stackCompressorMaxIterations, int stackLimit) {

    public static final OptimiserSettings DEFAULTS = new OptimiserSettings(12, 16, 16);

    public OptimiserSettings {
        if (maxRounds < 1 || stackCompressorMaxIterations < 0 || stackLimit < 1) {
            throw new IllegalArgumentException("Invalid optimiser settings: maxRounds=" + maxRounds
                    + ", stackCompressorMaxIterations=" + stackCompressorMaxIterations + ", stackLimit=" + stackLimit);
        }
    }
}
