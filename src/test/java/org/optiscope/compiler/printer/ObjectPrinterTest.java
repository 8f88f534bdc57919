package org.optiscope.compiler.printer;

import org.optiscope.compiler.frontend.parser.ObjectParser;
import org.optiscope.compiler.object.ObjectNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ObjectPrinterTest {

    @Test
    void printsNestedObjectsAndData() {
        ObjectNode root = new ObjectParser().parse(
                "object \"A\" { code { } object \"B\" { code { let x := 1 } data \"d\" hex\"0aff\" } }",
                "test.yul").root();

        String printed = new ObjectPrinter().print(root);

        assertThat(printed).isEqualTo("""
                object "A" {
                    code { }
                    object "B" {
                        code { let x := 1 }
                        data "d" hex"0aff"
                    }
                }""");
    }
}
