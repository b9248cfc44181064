package com.treeql.ast;

import java.util.List;

/**
 * A node with exactly one child.
 */
public abstract sealed class UnaryNode extends Node
    permits Pure, Take, Drop, Select {

    /**
     * Returns the only child of this node.
     *
     * @return the child
     */
    public abstract Node child();

    @Override
    public final List<Node> children() {
        return List.of(child());
    }

    @Override
    protected final Node nodeRebuild(List<Node> newChildren) {
        return rebuild(newChildren.get(0));
    }

    /**
     * Rebuilds this node with a new child.
     *
     * @param child the replacement child
     * @return the rebuilt node
     */
    protected abstract Node rebuild(Node child);
}
