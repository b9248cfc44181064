package com.treeql.ast;

import java.util.List;

/**
 * A node with exactly two children, {@code left} and {@code right}.
 */
public abstract sealed class BinaryNode extends Node
    permits Filter, GroupBy, Union, Bind, TableExpansion, TableRefExpansion, IfThen {

    public abstract Node left();

    public abstract Node right();

    @Override
    public final List<Node> children() {
        return List.of(left(), right());
    }

    @Override
    protected final Node nodeRebuild(List<Node> newChildren) {
        return rebuild(newChildren.get(0), newChildren.get(1));
    }

    /**
     * Rebuilds this node with new children.
     *
     * @param left the replacement left child
     * @param right the replacement right child
     * @return the rebuilt node
     */
    protected abstract Node rebuild(Node left, Node right);
}
