package org.optiscope.driver;

import org.optiscope.compiler.diagnostics.AnalysisException;
import org.optiscope.compiler.diagnostics.DiagnosticsEngine;
import org.optiscope.compiler.dialect.Dialect;
import org.optiscope.compiler.frontend.semantics.AnalysisInfo;
import org.optiscope.compiler.frontend.semantics.SemanticAnalyzer;
import org.optiscope.compiler.object.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs semantic analysis on object code and keeps each node's metadata in step with its code.
 * Only this class attaches analysis info to nodes.
 */
public class AnalyzerAdapter {

    private static final Logger log = LoggerFactory.getLogger(AnalyzerAdapter.class);

    private final Dialect dialect;
    private final ObjectTreeWalker walker;

    public AnalyzerAdapter(Dialect dialect, ObjectTreeWalker walker) {
        this.dialect = dialect;
        this.walker = walker;
    }

    /**
     * Analyzes one node's code and attaches the resulting info. On failure the node is left
     * without info, even if it had some before.
     *
     * @param node The node to analyze.
     * @param path The node's qualified path, used in the error.
     * @throws AnalysisException if the code is invalid.
     */
    public void analyze(ObjectNode node, String path) {
        node.clearAnalysisInfo();
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        AnalysisInfo info = new SemanticAnalyzer(dialect, diagnostics, node.qualifiedDataNames())
                .analyze(node.getCode());
        if (diagnostics.hasErrors()) {
            log.debug("Analysis of '{}' failed with {} error(s)", path, diagnostics.getErrors().size());
            throw new AnalysisException(path, diagnostics.getDiagnostics());
        }
        node.setAnalysisInfo(info);
        log.debug("Analyzed '{}': {} declarations", path, info.getDeclarationCount());
    }

    /**
     * Analyzes every node of the tree bottom-up. Stops at the first invalid node.
     * @throws AnalysisException for the first invalid node.
     */
    public void analyzeTree(ObjectNode root) {
        walker.walkWithPaths(root, (path, node) -> analyze(node, path));
    }

    /**
     * @return True if every node of the tree carries analysis info for its current code.
     */
    public boolean hasFreshAnalysis(ObjectNode root) {
        boolean[] fresh = {true};
        walker.walk(root, node -> fresh[0] &= node.getAnalysisInfo().isPresent());
        return fresh[0];
    }
}
