package org.optiscope.compiler.object;

/**
 * An entry nested inside an object: either a sub-object carrying code or a named data section.
 */
public interface IObjectEntry {

    /**
     * @return The entry name, unique among the entries of its parent object.
     */
    String name();
}
