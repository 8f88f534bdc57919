package org.optiscope.compiler.frontend.parser;

import org.optiscope.compiler.diagnostics.ParseException;
import org.optiscope.compiler.frontend.parser.ast.FunctionDefinition;
import org.optiscope.compiler.frontend.parser.ast.VariableDeclaration;
import org.optiscope.compiler.object.DataNode;
import org.optiscope.compiler.object.ObjectNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests parsing of bare code blocks and of object notation.
 */
@Tag("unit")
class ObjectParserTest {

    private final ObjectParser parser = new ObjectParser();

    @Test
    void bareBlockBecomesDefaultObject() {
        ParsedSource parsed = parser.parse("{ let x := 1 }", "test.yul");

        assertThat(parsed.codeBlockInput()).isTrue();
        assertThat(parsed.root().name()).isEqualTo(ObjectParser.DEFAULT_OBJECT_NAME);
        assertThat(parsed.root().getCode().statements()).singleElement().isInstanceOf(VariableDeclaration.class);
    }

    @Test
    void parsesNestedObjectsAndData() {
        String source = """
                object "A" {
                    code { function f(a) -> r { r := a } }
                    object "B" {
                        code { }
                        data "table" hex"0102"
                    }
                    data "name" "ab"
                }
                """;

        ParsedSource parsed = parser.parse(source, "test.yul");

        ObjectNode root = parsed.root();
        assertThat(parsed.codeBlockInput()).isFalse();
        assertThat(root.name()).isEqualTo("A");
        assertThat(root.getCode().statements()).singleElement().isInstanceOf(FunctionDefinition.class);
        assertThat(root.getChildren()).extracting(ObjectNode::name).containsExactly("B");
        assertThat(root.getChildren().get(0).findEntry("table")).get().isInstanceOf(DataNode.class);
        assertThat(((DataNode) root.findEntry("name").orElseThrow()).data()).containsExactly('a', 'b');
        assertThat(root.qualifiedDataNames()).containsExactly("A", "B", "B.table", "name");
    }

    @Test
    void rejectsDuplicateEntryNames() {
        String source = "object \"A\" { code { } data \"x\" hex\"00\" object \"x\" { code { } } }";

        assertThatThrownBy(() -> parser.parse(source, "test.yul"))
                .isInstanceOf(ParseException.class)
                .satisfies(e -> assertThat(((ParseException) e).getDiagnostics().get(0).message())
                        .contains("cannot be used twice"));
    }

    @Test
    void rejectsDottedObjectNames() {
        assertThatThrownBy(() -> parser.parse("object \"a.b\" { code { } }", "test.yul"))
                .isInstanceOf(ParseException.class);
    }

    @Test
    void rejectsObjectWithoutCode() {
        assertThatThrownBy(() -> parser.parse("object \"A\" { }", "test.yul"))
                .isInstanceOf(ParseException.class)
                .satisfies(e -> assertThat(((ParseException) e).getDiagnostics().get(0).message())
                        .isEqualTo("Expected 'code'."));
    }

    @Test
    void rejectsTrailingContent() {
        assertThatThrownBy(() -> parser.parse("{ } { }", "test.yul"))
                .isInstanceOf(ParseException.class)
                .hasMessage("Unexpected content after the end of the input: '{'.");
    }

    @Test
    void parsesTextAndHexDataSections() {
        ObjectNode root = parser.parse(
                "object \"A\" { code { } data \"text\" \"ab\" data \"raw\" hex\"ff00\" }", "test.yul").root();

        assertThat(root.getEntries()).extracting(e -> ((DataNode) e).toHex()).containsExactly("6162", "ff00");
    }

    @Test
    void reportsLexicalErrorsAsParseException() {
        assertThatThrownBy(() -> parser.parse("{ let x := # }", "test.yul"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("tokenize");
    }
}
