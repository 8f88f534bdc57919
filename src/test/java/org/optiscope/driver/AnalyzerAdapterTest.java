package org.optiscope.driver;

import org.optiscope.compiler.diagnostics.AnalysisException;
import org.optiscope.compiler.dialect.Dialect;
import org.optiscope.compiler.frontend.parser.ObjectParser;
import org.optiscope.compiler.object.ObjectNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class AnalyzerAdapterTest {

    private final AnalyzerAdapter analyzer = new AnalyzerAdapter(Dialect.evm(), new ObjectTreeWalker());

    private static ObjectNode parse(String source) {
        return new ObjectParser().parse(source, "test.yul").root();
    }

    @Test
    void attachesAnalysisInfoToEveryNode() {
        ObjectNode root = parse("object \"A\" { code { let x := datasize(\"B\") } object \"B\" { code { } } }");

        analyzer.analyzeTree(root);

        assertThat(root.getAnalysisInfo()).isPresent();
        assertThat(root.getChildren().get(0).getAnalysisInfo()).isPresent();
        assertThat(analyzer.hasFreshAnalysis(root)).isTrue();
    }

    @Test
    void failureNamesTheObjectAndClearsItsInfo() {
        ObjectNode root = parse("object \"A\" { code { } object \"B\" { code { pop(y) } } }");
        ObjectNode child = root.getChildren().get(0);

        assertThatThrownBy(() -> analyzer.analyzeTree(root))
                .isInstanceOf(AnalysisException.class)
                .satisfies(e -> {
                    AnalysisException analysis = (AnalysisException) e;
                    assertThat(analysis.getObjectPath()).isEqualTo("A.B");
                    assertThat(analysis.getDiagnostics()).isNotEmpty();
                });
        assertThat(child.getAnalysisInfo()).isEmpty();
        assertThat(analyzer.hasFreshAnalysis(root)).isFalse();
    }

    @Test
    void settingNewCodeInvalidatesInfo() {
        ObjectNode root = parse("{ let x := 1 }");
        analyzer.analyzeTree(root);

        root.setCode(root.getCode());

        assertThat(root.getAnalysisInfo()).isEmpty();
    }
}
