package org.optiscope.compiler.optimizer;

import org.optiscope.compiler.optimizer.features.controlflow.ControlFlowSimplifier;
import org.optiscope.compiler.optimizer.features.deadcode.DeadCodeEliminator;
import org.optiscope.compiler.optimizer.features.declinit.VarDeclInitializer;
import org.optiscope.compiler.optimizer.features.flatten.BlockFlattener;
import org.optiscope.compiler.optimizer.features.group.FunctionGrouper;
import org.optiscope.compiler.optimizer.features.hoist.FunctionHoister;
import org.optiscope.compiler.optimizer.features.loops.ForLoopConditionIntoBody;
import org.optiscope.compiler.optimizer.features.loops.ForLoopConditionOutOfBody;
import org.optiscope.compiler.optimizer.features.loops.ForLoopInitRewriter;
import org.optiscope.compiler.optimizer.features.prune.UnusedPruner;
import org.optiscope.compiler.optimizer.features.rematerialise.LiteralRematerialiser;
import org.optiscope.compiler.optimizer.features.simplify.ExpressionSimplifier;
import org.optiscope.compiler.optimizer.features.split.ExpressionSplitter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping single-character step codes to step descriptors.
 */
public final class StepRegistry {

    private final Map<Character, StepDescriptor> steps = new LinkedHashMap<>();

    /**
     * Registers a step under its abbreviation.
     * @param descriptor The step to register.
     * @throws IllegalArgumentException if the abbreviation is already taken.
     */
    public void register(StepDescriptor descriptor) {
        if (steps.containsKey(descriptor.abbreviation())) {
            throw new IllegalArgumentException("Step code '" + descriptor.abbreviation() + "' is already registered for "
                    + steps.get(descriptor.abbreviation()).name());
        }
        steps.put(descriptor.abbreviation(), descriptor);
    }

    public Optional<StepDescriptor> resolve(char abbreviation) {
        return Optional.ofNullable(steps.get(abbreviation));
    }

    public boolean contains(char abbreviation) {
        return steps.containsKey(abbreviation);
    }

    /**
     * @return All steps in registration order.
     */
    public List<StepDescriptor> getSteps() {
        return Collections.unmodifiableList(new ArrayList<>(steps.values()));
    }

    /**
     * Creates a registry with all built-in steps.
     * @return A fully initialized registry.
     */
    public static StepRegistry initializeWithDefaults() {
        StepRegistry registry = new StepRegistry();
        registry.register(new StepDescriptor('f', "BlockFlattener", true, new BlockFlattener()));
        registry.register(new StepDescriptor('g', "FunctionGrouper", false, new FunctionGrouper()));
        registry.register(new StepDescriptor('h', "FunctionHoister", true, new FunctionHoister()));
        registry.register(new StepDescriptor('d', "VarDeclInitializer", false, new VarDeclInitializer()));
        registry.register(new StepDescriptor('s', "ExpressionSimplifier", false, new ExpressionSimplifier()));
        registry.register(new StepDescriptor('x', "ExpressionSplitter", true, new ExpressionSplitter()));
        registry.register(new StepDescriptor('u', "UnusedPruner", true, new UnusedPruner()));
        registry.register(new StepDescriptor('D', "DeadCodeEliminator", false, new DeadCodeEliminator()));
        registry.register(new StepDescriptor('n', "ControlFlowSimplifier", false, new ControlFlowSimplifier()));
        registry.register(new StepDescriptor('o', "ForLoopInitRewriter", false, new ForLoopInitRewriter()));
        registry.register(new StepDescriptor('I', "ForLoopConditionIntoBody", false, new ForLoopConditionIntoBody()));
        registry.register(new StepDescriptor('O', "ForLoopConditionOutOfBody", false, new ForLoopConditionOutOfBody()));
        registry.register(new StepDescriptor('T', "LiteralRematerialiser", true, new LiteralRematerialiser()));
        return registry;
    }
}
