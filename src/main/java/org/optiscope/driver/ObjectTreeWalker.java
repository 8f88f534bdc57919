package org.optiscope.driver;

import org.optiscope.compiler.object.ObjectNode;

import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Post-order traversal of an object tree: all children of a node are visited, in document order,
 * before the node itself. Data sections are not visited. An exception thrown by the action aborts
 * the walk and propagates to the caller.
 */
public class ObjectTreeWalker {

    public void walk(ObjectNode root, Consumer<ObjectNode> action) {
        walkWithPaths(root, (path, node) -> action.accept(node));
    }

    /**
     * Walks the tree and passes each node's qualified path, starting with the root's name.
     * @param root   The root of the walk.
     * @param action Receives the qualified path and the node.
     */
    public void walkWithPaths(ObjectNode root, BiConsumer<String, ObjectNode> action) {
        visit(root, root.name(), action);
    }

    private void visit(ObjectNode node, String path, BiConsumer<String, ObjectNode> action) {
        for (ObjectNode child : node.getChildren()) {
            visit(child, path + "." + child.name(), action);
        }
        action.accept(path, node);
    }
}
