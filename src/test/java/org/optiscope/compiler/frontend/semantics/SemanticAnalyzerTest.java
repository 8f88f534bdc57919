package org.optiscope.compiler.frontend.semantics;

import org.optiscope.compiler.diagnostics.Diagnostic;
import org.optiscope.compiler.diagnostics.DiagnosticsEngine;
import org.optiscope.compiler.dialect.Dialect;
import org.optiscope.compiler.frontend.parser.ObjectParser;
import org.optiscope.compiler.frontend.parser.ast.Block;
import org.optiscope.compiler.frontend.parser.ast.ExpressionStatement;
import org.optiscope.compiler.frontend.parser.ast.FunctionCall;
import org.optiscope.compiler.frontend.parser.ast.Identifier;
import org.optiscope.compiler.frontend.parser.ast.VariableDeclaration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the two-pass analysis: name resolution, scoping rules, arity checks and control flow rules.
 */
@Tag("unit")
class SemanticAnalyzerTest {

    private DiagnosticsEngine diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
    }

    private AnalysisInfo analyze(String source, String... dataNames) {
        Block code = new ObjectParser().parse(source, "test.yul").root().getCode();
        return new SemanticAnalyzer(Dialect.evm(), diagnostics, Set.of(dataNames)).analyze(code);
    }

    private List<String> errors() {
        return diagnostics.getErrors().stream().map(Diagnostic::message).toList();
    }

    @Test
    void acceptsValidCode() {
        AnalysisInfo info = analyze("""
                {
                    let x := add(1, 2)
                    function f(a) -> r { let t := 2 r := mul(a, t) }
                    for { let i := 0 } lt(i, 10) { i := add(i, 1) } {
                        if eq(i, 5) { break }
                        sstore(i, f(i))
                    }
                    switch x case 0 { } default { mstore(0, x) }
                }
                """);

        assertThat(errors()).isEmpty();
        assertThat(info.getDeclaredNames()).contains("x", "f", "a", "r", "t", "i");
    }

    @Test
    void functionsAreVisibleBeforeTheirDefinition() {
        analyze("{ pop(g()) function g() -> v { v := 1 } }");

        assertThat(errors()).isEmpty();
    }

    @Test
    void resolvesReferencesToDeclarations() {
        Block code = new ObjectParser().parse("{ let x := 1 pop(x) }", "test.yul").root().getCode();
        AnalysisInfo info = new SemanticAnalyzer(Dialect.evm(), diagnostics, Set.of()).analyze(code);

        VariableDeclaration declaration = (VariableDeclaration) code.statements().get(0);
        FunctionCall pop = (FunctionCall) ((ExpressionStatement) code.statements().get(1)).expression();
        Symbol referenced = info.referencedSymbol((Identifier) pop.arguments().get(0)).orElseThrow();
        assertThat(info.declaredSymbol(declaration.variables().get(0))).contains(referenced);
    }

    @Test
    void reportsUndeclaredIdentifier() {
        analyze("{ pop(y) }");

        assertThat(errors()).containsExactly("Identifier \"y\" not found.");
    }

    @Test
    void reportsShadowingOfOuterVariable() {
        analyze("{ let x := 1 { let x := 2 } }");

        assertThat(errors()).containsExactly("Variable name \"x\" already taken in this scope.");
    }

    @Test
    void reportsAccessToVariableOutsideFunction() {
        analyze("{ let x := 1 function f() { pop(x) } }");

        assertThat(errors()).singleElement().asString().contains("declared outside the function");
    }

    @Test
    void reportsBuiltinNameAsVariable() {
        analyze("{ let add := 1 }");

        assertThat(errors()).singleElement().asString().contains("builtin function name");
    }

    @Test
    void reportsArityMismatch() {
        analyze("{ function f(a, b) { } f(1) }");

        assertThat(errors()).containsExactly("Function \"f\" expects 2 arguments but got 1.");
    }

    @Test
    void reportsValueCountMismatchInDeclaration() {
        analyze("{ function f() -> a, b { } let x := f() }");

        assertThat(errors()).singleElement().asString().startsWith("Variable count mismatch");
    }

    @Test
    void reportsTopLevelExpressionWithValue() {
        analyze("{ add(1, 2) }");

        assertThat(errors()).singleElement().asString().startsWith("Top-level expressions are not supposed");
    }

    @Test
    void reportsControlFlowOutsideItsContext() {
        analyze("{ break leave for { } 1 { continue } { } }");

        assertThat(errors()).containsExactly(
                "Keyword \"break\" needs to be inside a for-loop body.",
                "Keyword \"leave\" can only be used inside a function.",
                "Keyword \"continue\" needs to be inside a for-loop body.");
    }

    @Test
    void reportsFunctionInLoopInit() {
        analyze("{ for { function f() { } } 1 { } { break } }");

        assertThat(errors()).contains("Functions cannot be defined inside a for-loop init block.");
    }

    @Test
    void reportsDuplicateCasesAndWarnsOnDefaultOnlySwitch() {
        analyze("{ switch 1 case 0 { } case 0x0 { } switch 2 default { } }");

        assertThat(errors()).singleElement().asString().startsWith("Duplicate case");
        assertThat(diagnostics.getDiagnostics()).anyMatch(d -> d.type() == Diagnostic.Type.WARNING);
    }

    @Test
    void checksDataReferencesAgainstKnownNames() {
        analyze("{ pop(datasize(\"runtime\")) pop(datasize(\"missing\")) }", "runtime");

        assertThat(errors()).containsExactly("Unknown data object \"missing\".");
    }
}
