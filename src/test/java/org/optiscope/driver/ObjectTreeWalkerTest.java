package org.optiscope.driver;

import org.optiscope.compiler.frontend.parser.ObjectParser;
import org.optiscope.compiler.object.ObjectNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ObjectTreeWalkerTest {

    static final String TREE = """
            object "A" {
                code { }
                object "B" {
                    code { }
                    object "C" { code { } }
                    data "table" hex"00"
                }
                object "D" { code { } }
            }
            """;

    private final ObjectNode root = new ObjectParser().parse(TREE, "tree.yul").root();

    @Test
    void visitsChildrenBeforeParentsInDocumentOrder() {
        List<String> visited = new ArrayList<>();

        new ObjectTreeWalker().walkWithPaths(root, (path, node) -> visited.add(path));

        assertThat(visited).containsExactly("A.B.C", "A.B", "A.D", "A");
    }

    @Test
    void walkPassesNodesOnly() {
        List<String> names = new ArrayList<>();

        new ObjectTreeWalker().walk(root, node -> names.add(node.name()));

        assertThat(names).containsExactly("C", "B", "D", "A");
    }

    @Test
    void exceptionAbortsTheWalk() {
        List<String> visited = new ArrayList<>();

        assertThatThrownBy(() -> new ObjectTreeWalker().walk(root, node -> {
            visited.add(node.name());
            if (node.name().equals("B")) {
                throw new IllegalStateException("stop");
            }
        })).hasMessage("stop");
        assertThat(visited).containsExactly("C", "B");
    }
}
