package org.optiscope.driver;

import org.optiscope.compiler.dialect.Dialect;
import org.optiscope.compiler.frontend.parser.ObjectParser;
import org.optiscope.compiler.frontend.parser.ParsedSource;
import org.optiscope.compiler.object.ObjectNode;
import org.optiscope.compiler.optimizer.StepRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.Reader;

/**
 * Wires one exploration session: parses the source, selects the object to work on, validates it
 * and provides the sequencer, the batch runner and the interactive controller operating on it.
 */
public class Explorer {

    private static final Logger log = LoggerFactory.getLogger(Explorer.class);

    private final SessionState state;
    private final StepRegistry registry;
    private final TransformationSequencer sequencer;
    private final ExplorerSettings settings;
    private final SourceInput source;
    private final TreeRenderer renderer = new TreeRenderer();

    private Explorer(SessionState state, StepRegistry registry, TransformationSequencer sequencer,
                     ExplorerSettings settings, SourceInput source) {
        this.state = state;
        this.registry = registry;
        this.sequencer = sequencer;
        this.settings = settings;
        this.source = source;
    }

    /**
     * Parses and validates the source.
     *
     * @param source     The source to explore.
     * @param objectPath The dotted path of the object to work on, or {@code null} for the root.
     * @param settings   The session settings.
     * @return A session whose tree passed initial analysis.
     * @throws org.optiscope.compiler.diagnostics.ParseException    if the source is malformed.
     * @throws ConfigurationException                               if the object path cannot be resolved.
     * @throws org.optiscope.compiler.diagnostics.AnalysisException if the selected tree is invalid.
     */
    public static Explorer open(SourceInput source, String objectPath, ExplorerSettings settings) {
        ParsedSource parsed = new ObjectParser().parse(source.text(), source.name());
        ObjectNode root = parsed.root();
        if (objectPath != null) {
            root = new SubObjectResolver().resolve(root, objectPath);
        }
        Dialect dialect = Dialect.evm();
        ObjectTreeWalker walker = new ObjectTreeWalker();
        AnalyzerAdapter analyzer = new AnalyzerAdapter(dialect, walker);
        analyzer.analyzeTree(root);

        SessionState state = new SessionState(root, parsed.codeBlockInput(), dialect,
                settings.reservedIdentifiers(), settings.optimiser(), walker);
        StepRegistry registry = StepRegistry.initializeWithDefaults();
        TransformationSequencer sequencer = new TransformationSequencer(state, registry, analyzer, walker);
        log.info("Opened '{}' from {} ({})", root.name(), source.name(),
                parsed.codeBlockInput() ? "code block" : "object");
        return new Explorer(state, registry, sequencer, settings, source);
    }

    public SessionState getState() {
        return state;
    }

    public StepRegistry getRegistry() {
        return registry;
    }

    public SourceInput getSource() {
        return source;
    }

    public String render() {
        return renderer.render(state);
    }

    public BatchRunner batchRunner() {
        return new BatchRunner(state, sequencer, registry);
    }

    public InteractiveSession interactiveSession(Reader in, PrintWriter out, PrintWriter err) {
        return new InteractiveSession(state, sequencer, registry, settings, renderer, source, in, out, err);
    }
}
