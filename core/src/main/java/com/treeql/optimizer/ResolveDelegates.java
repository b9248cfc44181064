package com.treeql.optimizer;

import com.treeql.ast.Node;
import com.treeql.ast.Nodes;

/**
 * Replaces every node by its delegate, bottom-up.
 *
 * <p>This is the only place where delegates take effect. Constructing a node
 * never substitutes it, so a {@code Filter} with a literal {@code true}
 * predicate stays a {@code Filter} until this rule runs.
 */
public class ResolveDelegates implements OptimizationRule {

    @Override
    public Node apply(Node node) {
        return Nodes.transformUp(node, Nodes::resolve);
    }
}
