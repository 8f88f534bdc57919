package org.optiscope.driver;

import org.optiscope.compiler.diagnostics.AnalysisException;
import org.optiscope.compiler.frontend.semantics.AnalysisInfo;
import org.optiscope.compiler.object.ObjectNode;
import org.optiscope.compiler.optimizer.NameDispenser;
import org.optiscope.compiler.optimizer.StepContext;
import org.optiscope.compiler.optimizer.StepRegistry;
import org.optiscope.compiler.optimizer.features.cleanup.VarNameCleaner;
import org.optiscope.compiler.optimizer.features.disambiguate.Disambiguator;
import org.optiscope.compiler.optimizer.features.stack.StackCompressor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies transformations to every object of the session tree and re-validates the tree
 * afterwards. Every operation ends with a whole-tree analysis and reports the result as a
 * {@link StepOutcome}; it never reports success for a tree that fails analysis.
 * <p>
 * Steps that rely on unique names are preceded by a disambiguation if the session is not
 * disambiguated. That requires fresh analysis info on every node; without it such steps are
 * rejected and the tree is left untouched.
 */
public class TransformationSequencer {

    private static final Logger log = LoggerFactory.getLogger(TransformationSequencer.class);

    private final SessionState state;
    private final StepRegistry registry;
    private final AnalyzerAdapter analyzer;
    private final ObjectTreeWalker walker;

    public TransformationSequencer(SessionState state, StepRegistry registry, AnalyzerAdapter analyzer,
                                   ObjectTreeWalker walker) {
        this.state = state;
        this.registry = registry;
        this.analyzer = analyzer;
        this.walker = walker;
    }

    /**
     * Renames declarations so that identifiers are unique across the whole tree.
     * @throws InvariantViolationException if a node has no fresh analysis info.
     */
    public StepOutcome disambiguate() {
        ObjectNode root = state.getRoot();
        NameDispenser dispenser = new NameDispenser(state.getDialect(), state.getReservedIdentifiers());
        Disambiguator disambiguator = new Disambiguator(dispenser);
        walker.walkWithPaths(root, (path, node) -> {
            AnalysisInfo info = node.getAnalysisInfo().orElseThrow(() -> new InvariantViolationException(
                    "Disambiguation of '" + path + "' requires fresh analysis info."));
            node.setCode(disambiguator.run(node.getCode(), info));
        });
        StepOutcome outcome = validate("Disambiguator");
        state.setDisambiguated(outcome.isSuccess());
        log.debug("Disambiguation finished: {}", outcome.status());
        return outcome;
    }

    /**
     * Applies a step sequence to every object. The whole sequence is validated first, so an
     * unknown code or malformed brackets reject it before anything changes.
     */
    public StepOutcome runSequence(String steps) {
        StepSequence sequence;
        try {
            sequence = StepSequence.parse(steps, registry);
        } catch (UnknownStepException | ConfigurationException e) {
            return StepOutcome.rejected(e.getMessage(), e);
        }
        if (sequence.requiresDisambiguation()) {
            StepOutcome repaired = ensureDisambiguated("Sequence '" + steps.strip() + "'");
            if (repaired != null) {
                return repaired;
            }
        }
        state.resetStepContext();
        StepContext context = state.getStepContext();
        try {
            walker.walkWithPaths(state.getRoot(), (path, node) -> {
                log.debug("Applying '{}' to '{}'", sequence, path);
                node.setCode(sequence.apply(context, node.getCode()));
            });
        } catch (InvariantViolationException e) {
            throw e;
        } catch (RuntimeException e) {
            return StepOutcome.failed("Sequence '" + steps.strip() + "' failed: " + e.getMessage(), List.of(), e);
        }
        return validate("Sequence '" + steps.strip() + "'");
    }

    /**
     * Runs one of the fixed utilities on every object.
     */
    public StepOutcome runNamedUtility(UtilityKind kind) {
        return switch (kind) {
            case VAR_NAME_CLEANER -> runVarNameCleaner();
            case STACK_COMPRESSOR -> runStackCompressor();
        };
    }

    private StepOutcome runVarNameCleaner() {
        state.resetStepContext();
        StepContext context = state.getStepContext();
        VarNameCleaner cleaner = new VarNameCleaner();
        // readable names may repeat across functions; cleared first so a partial run counts too
        state.setDisambiguated(false);
        walker.walk(state.getRoot(), node -> node.setCode(cleaner.run(context, node.getCode())));
        return validate(UtilityKind.VAR_NAME_CLEANER.getDisplayName());
    }

    private StepOutcome runStackCompressor() {
        String name = UtilityKind.STACK_COMPRESSOR.getDisplayName();
        StepOutcome repaired = ensureDisambiguated(name);
        if (repaired != null) {
            return repaired;
        }
        state.resetStepContext();
        StepContext context = state.getStepContext();
        StackCompressor compressor = new StackCompressor();
        List<String> overLimit = new ArrayList<>();
        walker.walkWithPaths(state.getRoot(), (path, node) -> {
            StackCompressor.Result result = compressor.run(context, node.getCode());
            if (!result.limitMet()) {
                overLimit.add(path);
            }
            node.setCode(result.code());
        });
        StepOutcome outcome = validate(name);
        if (outcome.isSuccess() && !overLimit.isEmpty()) {
            return StepOutcome.succeeded(name + " could not reach the stack limit in " + String.join(", ", overLimit));
        }
        return outcome;
    }

    /**
     * Re-establishes unique names if needed.
     * @return {@code null} if the tree is disambiguated now, otherwise the outcome to report.
     */
    private StepOutcome ensureDisambiguated(String operation) {
        if (state.isDisambiguated()) {
            return null;
        }
        if (!analyzer.hasFreshAnalysis(state.getRoot())) {
            return StepOutcome.rejected(operation + " requires unique names, but the tree is not disambiguated "
                    + "and its last analysis failed.", null);
        }
        log.warn("{} requires unique names, re-running disambiguation first", operation);
        StepOutcome outcome = disambiguate();
        return outcome.isSuccess() ? null : outcome;
    }

    /**
     * Re-analyzes the whole tree.
     */
    private StepOutcome validate(String operation) {
        try {
            analyzer.analyzeTree(state.getRoot());
        } catch (AnalysisException e) {
            return StepOutcome.failed(operation + " produced invalid code in '" + e.getObjectPath() + "'",
                    e.getDiagnostics(), e);
        }
        return StepOutcome.succeeded(operation + " applied");
    }
}
