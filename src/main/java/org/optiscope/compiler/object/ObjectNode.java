package org.optiscope.compiler.object;

import org.optiscope.compiler.frontend.parser.ast.Block;
import org.optiscope.compiler.frontend.semantics.AnalysisInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A named unit of code that may embed further objects and data sections.
 * <p>
 * The node owns its code exclusively. Replacing the code always drops the attached
 * {@link AnalysisInfo}, so metadata can only ever describe the current code. Nodes hold no
 * reference to their parent; callers that need ancestry pass the qualified path explicitly.
 */
public class ObjectNode implements IObjectEntry {

    private final String name;
    private final List<IObjectEntry> entries = new ArrayList<>();
    private Block code;
    private AnalysisInfo analysisInfo;

    /**
     * Creates an object with the given code and no nested entries.
     * @param name The object name.
     * @param code The code block.
     */
    public ObjectNode(String name, Block code) {
        this.name = name;
        this.code = code;
    }

    @Override
    public String name() {
        return name;
    }

    public Block getCode() {
        return code;
    }

    /**
     * Replaces the code of this object and invalidates its analysis metadata.
     * @param newCode The new code block.
     */
    public void setCode(Block newCode) {
        this.code = newCode;
        this.analysisInfo = null;
    }

    /**
     * Adds a nested object or data section.
     * @param entry The entry to add.
     * @throws IllegalArgumentException if an entry with the same name already exists.
     */
    public void addEntry(IObjectEntry entry) {
        if (findEntry(entry.name()).isPresent()) {
            throw new IllegalArgumentException(
                    "Object '" + name + "' already contains an entry named '" + entry.name() + "'");
        }
        entries.add(entry);
    }

    /**
     * @return All nested entries in document order.
     */
    public List<IObjectEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    /**
     * @return The nested objects in document order, data sections excluded.
     */
    public List<ObjectNode> getChildren() {
        List<ObjectNode> children = new ArrayList<>();
        for (IObjectEntry entry : entries) {
            if (entry instanceof ObjectNode child) {
                children.add(child);
            }
        }
        return children;
    }

    public Optional<IObjectEntry> findEntry(String entryName) {
        return entries.stream().filter(e -> e.name().equals(entryName)).findFirst();
    }

    public Optional<AnalysisInfo> getAnalysisInfo() {
        return Optional.ofNullable(analysisInfo);
    }

    /**
     * Attaches analysis metadata that was computed for the current code.
     * Only the analyzer adapter calls this.
     */
    public void setAnalysisInfo(AnalysisInfo analysisInfo) {
        this.analysisInfo = analysisInfo;
    }

    public void clearAnalysisInfo() {
        this.analysisInfo = null;
    }

    /**
     * Returns the names that {@code datasize}/{@code dataoffset} may refer to from this object:
     * its own name, the names of all direct entries and the dotted paths into nested objects.
     */
    public Set<String> qualifiedDataNames() {
        Set<String> names = new LinkedHashSet<>();
        names.add(name);
        collectQualifiedNames(this, "", names);
        return names;
    }

    private static void collectQualifiedNames(ObjectNode object, String prefix, Set<String> names) {
        for (IObjectEntry entry : object.entries) {
            String qualified = prefix + entry.name();
            names.add(qualified);
            if (entry instanceof ObjectNode child) {
                collectQualifiedNames(child, qualified + ".", names);
            }
        }
    }

    @Override
    public String toString() {
        return "ObjectNode[" + name + "]";
    }
}
