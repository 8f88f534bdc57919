package org.optiscope.driver;

import org.optiscope.compiler.dialect.Dialect;
import org.optiscope.compiler.object.ObjectNode;
import org.optiscope.compiler.optimizer.NameCollector;
import org.optiscope.compiler.optimizer.NameDispenser;
import org.optiscope.compiler.optimizer.OptimiserSettings;
import org.optiscope.compiler.optimizer.StepContext;

import java.util.HashSet;
import java.util.Set;

/**
 * The state of one exploration session: the tree under exploration, whether its identifiers
 * are currently unique, and the step context handed to the next step.
 */
public class SessionState {

    private final ObjectNode root;
    private final boolean codeBlockInput;
    private final Dialect dialect;
    private final Set<String> reservedIdentifiers;
    private final OptimiserSettings settings;
    private final ObjectTreeWalker walker;
    private boolean disambiguated = false;
    private StepContext stepContext;

    /**
     * @param root                The object tree, or the selected sub-object of it.
     * @param codeBlockInput      True if the input was a bare code block.
     * @param dialect             The session dialect.
     * @param reservedIdentifiers Names no step may introduce.
     * @param settings            Step tuning values.
     * @param walker              The walker used to collect names.
     */
    public SessionState(ObjectNode root, boolean codeBlockInput, Dialect dialect, Set<String> reservedIdentifiers,
                        OptimiserSettings settings, ObjectTreeWalker walker) {
        this.root = root;
        this.codeBlockInput = codeBlockInput;
        this.dialect = dialect;
        this.reservedIdentifiers = Set.copyOf(reservedIdentifiers);
        this.settings = settings;
        this.walker = walker;
        resetStepContext();
    }

    public ObjectNode getRoot() {
        return root;
    }

    public boolean isCodeBlockInput() {
        return codeBlockInput;
    }

    public Dialect getDialect() {
        return dialect;
    }

    public Set<String> getReservedIdentifiers() {
        return reservedIdentifiers;
    }

    public boolean isDisambiguated() {
        return disambiguated;
    }

    public void setDisambiguated(boolean disambiguated) {
        this.disambiguated = disambiguated;
    }

    public StepContext getStepContext() {
        return stepContext;
    }

    /**
     * Rebuilds the step context with a name dispenser that knows every name currently used
     * anywhere in the tree.
     */
    public void resetStepContext() {
        Set<String> used = new HashSet<>();
        walker.walk(root, node -> used.addAll(NameCollector.collect(node.getCode())));
        NameDispenser dispenser = new NameDispenser(dialect, reservedIdentifiers, used);
        stepContext = new StepContext(dialect, dispenser, reservedIdentifiers, settings);
    }
}
