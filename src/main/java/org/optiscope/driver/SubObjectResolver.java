package org.optiscope.driver;

import org.optiscope.compiler.object.IObjectEntry;
import org.optiscope.compiler.object.ObjectNode;

import java.util.Arrays;
import java.util.Optional;

/**
 * Resolves a dotted qualified path such as {@code A.B.C} against an object tree. The first
 * segment names the root itself; every further segment must name a direct child object.
 */
public class SubObjectResolver {

    /**
     * @param root The tree root.
     * @param path The qualified path.
     * @return The addressed object.
     * @throws ConfigurationException if the path is empty, does not start with the root's name,
     *                                names a missing entry or a data section.
     */
    public ObjectNode resolve(ObjectNode root, String path) {
        if (path == null || path.isBlank()) {
            throw new ConfigurationException("The object path must not be empty.");
        }
        String[] segments = path.split("\\.", -1);
        if (!segments[0].equals(root.name())) {
            throw new ConfigurationException("Object path '" + path + "' does not start with the root object '"
                    + root.name() + "'.");
        }
        ObjectNode current = root;
        for (int i = 1; i < segments.length; i++) {
            Optional<IObjectEntry> entry = current.findEntry(segments[i]);
            if (entry.isEmpty()) {
                throw new ConfigurationException("Object '" + segments[i] + "' not found in '"
                        + String.join(".", Arrays.copyOf(segments, i)) + "' (path '" + path + "').");
            }
            if (!(entry.get() instanceof ObjectNode child)) {
                throw new ConfigurationException("'" + segments[i] + "' in path '" + path + "' is a data section, not an object.");
            }
            current = child;
        }
        return current;
    }
}
