package org.optiscope.compiler.frontend.semantics;

import org.optiscope.compiler.frontend.parser.ast.Assignment;
import org.optiscope.compiler.frontend.parser.ast.AstNode;
import org.optiscope.compiler.frontend.parser.ast.Block;
import org.optiscope.compiler.frontend.parser.ast.Break;
import org.optiscope.compiler.frontend.parser.ast.Continue;
import org.optiscope.compiler.frontend.parser.ast.ExpressionStatement;
import org.optiscope.compiler.frontend.parser.ast.ForLoop;
import org.optiscope.compiler.frontend.parser.ast.FunctionDefinition;
import org.optiscope.compiler.frontend.parser.ast.If;
import org.optiscope.compiler.frontend.parser.ast.Leave;
import org.optiscope.compiler.frontend.parser.ast.Switch;
import org.optiscope.compiler.frontend.parser.ast.VariableDeclaration;
import org.optiscope.compiler.frontend.semantics.analysis.AssignmentAnalysisHandler;
import org.optiscope.compiler.frontend.semantics.analysis.BlockAnalysisHandler;
import org.optiscope.compiler.frontend.semantics.analysis.ControlFlowAnalysisHandler;
import org.optiscope.compiler.frontend.semantics.analysis.ExpressionStatementAnalysisHandler;
import org.optiscope.compiler.frontend.semantics.analysis.ForLoopAnalysisHandler;
import org.optiscope.compiler.frontend.semantics.analysis.FunctionDefinitionAnalysisHandler;
import org.optiscope.compiler.frontend.semantics.analysis.FunctionSymbolCollector;
import org.optiscope.compiler.frontend.semantics.analysis.IAnalysisHandler;
import org.optiscope.compiler.frontend.semantics.analysis.ISymbolCollector;
import org.optiscope.compiler.frontend.semantics.analysis.IfAnalysisHandler;
import org.optiscope.compiler.frontend.semantics.analysis.SwitchAnalysisHandler;
import org.optiscope.compiler.frontend.semantics.analysis.VariableDeclarationAnalysisHandler;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping AST node classes to analysis handlers (pass 2) and symbol collectors (pass 1).
 */
public final class AnalysisHandlerRegistry {

    private final Map<Class<? extends AstNode>, IAnalysisHandler> handlers = new HashMap<>();
    private final Map<Class<? extends AstNode>, ISymbolCollector> collectors = new HashMap<>();

    /**
     * Registers a pass-2 analysis handler for the given AST node class.
     *
     * @param nodeType The concrete AST node class.
     * @param handler  The handler instance.
     * @param <T>      Concrete AST type parameter.
     */
    public <T extends AstNode> void register(Class<T> nodeType, IAnalysisHandler handler) {
        handlers.put(nodeType, handler);
    }

    /**
     * Registers a pass-1 symbol collector for the given AST node class.
     *
     * @param nodeType  The concrete AST node class.
     * @param collector The collector instance.
     * @param <T>       Concrete AST type parameter.
     */
    public <T extends AstNode> void registerCollector(Class<T> nodeType, ISymbolCollector collector) {
        collectors.put(nodeType, collector);
    }

    public Optional<IAnalysisHandler> resolveHandler(Class<? extends AstNode> nodeType) {
        return Optional.ofNullable(handlers.get(nodeType));
    }

    public Optional<ISymbolCollector> resolveCollector(Class<? extends AstNode> nodeType) {
        return Optional.ofNullable(collectors.get(nodeType));
    }

    /**
     * Creates a registry pre-populated with the default handlers and collectors.
     *
     * @param expressions The expression checker shared by all handlers that check values.
     * @return A fully initialized registry.
     */
    public static AnalysisHandlerRegistry initializeWithDefaults(ExpressionChecker expressions) {
        AnalysisHandlerRegistry registry = new AnalysisHandlerRegistry();

        // Pass-1 collectors
        registry.registerCollector(FunctionDefinition.class, new FunctionSymbolCollector());

        // Pass-2 handlers
        registry.register(Block.class, new BlockAnalysisHandler());
        registry.register(FunctionDefinition.class, new FunctionDefinitionAnalysisHandler());
        registry.register(VariableDeclaration.class, new VariableDeclarationAnalysisHandler(expressions));
        registry.register(Assignment.class, new AssignmentAnalysisHandler(expressions));
        registry.register(ExpressionStatement.class, new ExpressionStatementAnalysisHandler(expressions));
        registry.register(If.class, new IfAnalysisHandler(expressions));
        registry.register(Switch.class, new SwitchAnalysisHandler(expressions));
        registry.register(ForLoop.class, new ForLoopAnalysisHandler(expressions));
        ControlFlowAnalysisHandler controlFlow = new ControlFlowAnalysisHandler();
        registry.register(Break.class, controlFlow);
        registry.register(Continue.class, controlFlow);
        registry.register(Leave.class, controlFlow);

        return registry;
    }
}
