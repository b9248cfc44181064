package com.treeql.optimizer;

import com.treeql.ast.Node;

/**
 * Interface for tree rewriting rules.
 *
 * <p>A rule transforms a tree into an equivalent tree. It must return the
 * argument itself, not an equal copy, when it finds nothing to rewrite:
 * {@link QueryOptimizer} relies on this to detect its fixpoint cheaply.
 * Rules built on {@link Node#mapChildren} get this for free.
 *
 * <p>Rules should be idempotent. Applying the same rule twice should not
 * cause further changes after the first application.
 */
public interface OptimizationRule {

    /**
     * Applies this rule to a tree.
     *
     * @param node the input tree
     * @return the rewritten tree, or {@code node} itself if the rule did not apply
     */
    Node apply(Node node);

    /**
     * Returns the name of this rule, used for logging.
     *
     * @return the rule name
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
