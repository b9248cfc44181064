package com.treeql.ast;

import java.util.List;

/**
 * A node without children. Rebuilding returns the node itself.
 */
public abstract sealed class NullaryNode extends Node
    permits LiteralNode, Ref, TableNode, SequenceNode, RangeFrom {

    @Override
    public final List<Node> children() {
        return List.of();
    }

    @Override
    protected final Node nodeRebuild(List<Node> newChildren) {
        return this;
    }
}
