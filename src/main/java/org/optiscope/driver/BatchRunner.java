package org.optiscope.driver;

import org.optiscope.compiler.optimizer.StepRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-interactive mode: disambiguate, run one step sequence, done. Any failure is fatal.
 */
public class BatchRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    private final SessionState state;
    private final TransformationSequencer sequencer;
    private final StepRegistry registry;

    public BatchRunner(SessionState state, TransformationSequencer sequencer, StepRegistry registry) {
        this.state = state;
        this.sequencer = sequencer;
        this.registry = registry;
    }

    /**
     * @param steps The step sequence.
     * @throws UnknownStepException   for an unknown step code.
     * @throws ConfigurationException for a malformed sequence.
     * @throws org.optiscope.compiler.diagnostics.AnalysisException if a step produced invalid code.
     */
    public void run(String steps) {
        // reject a bad sequence before disambiguation touches the tree
        StepSequence.parse(steps, registry);
        if (!state.isDisambiguated()) {
            sequencer.disambiguate().orThrow();
        }
        StepOutcome outcome = sequencer.runSequence(steps).orThrow();
        log.info("Batch sequence '{}' finished: {}", steps, outcome.summary());
    }
}
