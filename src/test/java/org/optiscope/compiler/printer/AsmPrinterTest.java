package org.optiscope.compiler.printer;

import org.optiscope.compiler.frontend.parser.ObjectParser;
import org.optiscope.compiler.frontend.parser.ast.Block;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class AsmPrinterTest {

    private final AsmPrinter printer = new AsmPrinter();

    private String roundTrip(String source) {
        Block code = new ObjectParser().parse(source, "test.yul").root().getCode();
        return printer.print(code);
    }

    @Test
    void printsEmptyBlock() {
        assertThat(roundTrip("{}")).isEqualTo("{ }");
    }

    @Test
    void printsShortBlockInline() {
        assertThat(roundTrip("{ let x := 1 }")).isEqualTo("{ let x := 1 }");
    }

    @Test
    void printsLongBlockWithIndentation() {
        String printed = roundTrip("{ let x := add(1, 2) sstore(x, calldataload(0)) }");

        assertThat(printed).isEqualTo("""
                {
                    let x := add(1, 2)
                    sstore(x, calldataload(0))
                }""");
    }

    @Test
    void printsFunctionsAndControlFlow() {
        String printed = roundTrip("""
                {
                    function f(a, b) -> r { r := a }
                    for { let i := 0 } lt(i, 2) { i := add(i, 1) } { }
                    switch f(1, 2) case 1 { } default { invalid() }
                }""");

        assertThat(printed).isEqualTo("""
                {
                    function f(a, b) -> r
                    { r := a }
                    for { let i := 0 } lt(i, 2) { i := add(i, 1) } { }
                    switch f(1, 2)
                    case 1 { }
                    default { invalid() }
                }""");
    }

    @Test
    void printedCodeParsesToTheSameText() {
        String once = roundTrip("{ if eq(1, 2) { let a, b := g() } function g() -> x, y { } }");

        assertThat(roundTrip(once)).isEqualTo(once);
    }

    @Test
    void escapesStringLiterals() {
        assertThat(AsmPrinter.escape("a\"b\n\u0001")).isEqualTo("a\\\"b\\n\\x01");
    }
}
