package com.treeql.optimizer;

import com.treeql.ast.Node;
import com.treeql.ast.TreeDump;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies rewrite rules to a tree until it stops changing.
 *
 * <p>Each iteration applies all rules in order. The loop ends when an
 * iteration returns the very same instance it started with, or a structurally
 * equal tree, or when the iteration bound is reached. Because rules preserve
 * the identity of untouched subtrees, the final, unchanging iteration costs
 * one traversal and no allocation.
 *
 * <p>Example usage:
 * <pre>
 *   QueryOptimizer optimizer = new QueryOptimizer();
 *   Node optimized = optimizer.optimize(tree);
 * </pre>
 *
 * <p>The only default rule is {@link ResolveDelegates}, which replaces nodes
 * by their delegates. {@link AssignUniqueSymbols} allocates fresh symbols on
 * every run and never settles, so it is not a default rule.
 */
public class QueryOptimizer {

    private static final Logger logger = LoggerFactory.getLogger(QueryOptimizer.class);

    private final List<OptimizationRule> rules;
    private final OptimizerConfig config;

    /**
     * Creates an optimizer with the default rules, configured from system
     * properties.
     */
    public QueryOptimizer() {
        this(createDefaultRules(), OptimizerConfig.fromSystemProperties());
    }

    /**
     * Creates an optimizer with custom rules.
     *
     * @param rules the rules to apply, in order
     * @param config the optimizer settings
     */
    public QueryOptimizer(List<OptimizationRule> rules, OptimizerConfig config) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules must not be null"));
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Rewrites a tree to a fixpoint of the rules.
     *
     * @param node the input tree
     * @return the rewritten tree, or {@code node} itself if no rule applied
     */
    public Node optimize(Node node) {
        Objects.requireNonNull(node, "node must not be null");

        Node current = node;
        for (int iteration = 1; iteration <= config.maxIterations(); iteration++) {
            Node previous = current;

            for (OptimizationRule rule : rules) {
                Node rewritten = Objects.requireNonNull(rule.apply(current),
                    () -> "rule " + rule.name() + " returned null");
                if (rewritten != current) {
                    logger.debug("Iteration {}: rule {} changed the tree", iteration, rule.name());
                    if (config.dumpTrees() && logger.isDebugEnabled()) {
                        logger.debug("Tree after {}:\n{}", rule.name(), TreeDump.dump(rewritten));
                    }
                }
                current = rewritten;
            }

            if (current == previous || current.equals(previous)) {
                logger.debug("Reached fixpoint after {} iteration(s)", iteration);
                return current;
            }
        }

        logger.warn("Optimizer stopped after {} iterations without reaching a fixpoint", config.maxIterations());
        return current;
    }

    /**
     * Creates the default set of rules.
     *
     * @return the default rules
     */
    public static List<OptimizationRule> createDefaultRules() {
        List<OptimizationRule> defaults = new ArrayList<>();
        defaults.add(new ResolveDelegates());
        return defaults;
    }

    public List<OptimizationRule> rules() {
        return rules;
    }

    public OptimizerConfig config() {
        return config;
    }
}
