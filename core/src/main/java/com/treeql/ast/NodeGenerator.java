package com.treeql.ast;

/**
 * An object that can produce a {@link Node}.
 *
 * <p>Query-building code implements this on its own value types so they can be
 * passed wherever a node is expected (see {@link Nodes#of(Object)}).
 */
public interface NodeGenerator {

    /**
     * Returns the node that should be used in place of this object.
     *
     * @return the delegate node
     */
    Node delegate();
}
