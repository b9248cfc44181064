package com.treeql.optimizer;

import com.treeql.ast.DefNode;
import com.treeql.ast.Generator;
import com.treeql.ast.Node;
import com.treeql.ast.Ref;
import com.treeql.symbol.AnonSymbol;
import com.treeql.symbol.Symbol;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gives every binding in a tree a fresh {@link AnonSymbol}.
 *
 * <p>Each generator of each {@link DefNode} is renamed, and every {@link Ref}
 * inside the scope of that generator is rewritten to the new symbol. Inner
 * bindings shadow outer ones. References to symbols that are not bound inside
 * the tree are left as they are, and so are field symbols of {@code Select}
 * and function symbols of {@code Apply}.
 *
 * <p>After this rule no two binding nodes share a generator symbol, which
 * later passes can rely on when they move subtrees around.
 *
 * <p>The rule allocates new symbols on every application, so it never reaches
 * a fixpoint. Apply it once, either directly or through a
 * {@link QueryOptimizer} with {@code maxIterations} 1.
 */
public class AssignUniqueSymbols implements OptimizationRule {

    private static final Logger logger = LoggerFactory.getLogger(AssignUniqueSymbols.class);

    @Override
    public Node apply(Node node) {
        return transform(node, Map.of());
    }

    private Node transform(Node node, Map<Symbol, Symbol> env) {
        if (node instanceof Ref) {
            Symbol renamed = env.get(((Ref) node).symbol());
            return renamed == null ? node : ((Ref) node).mapReference(s -> renamed);
        }
        if (!(node instanceof DefNode)) {
            return node.mapChildren(child -> transform(child, env));
        }

        DefNode def = (DefNode) node;
        List<Generator> generators = def.generators();
        if (generators.isEmpty()) {
            return node.mapChildren(child -> transform(child, env));
        }

        Map<Symbol, Symbol> fresh = new HashMap<>();
        List<Symbol> newSymbols = new ArrayList<>(generators.size());
        for (Generator generator : generators) {
            Symbol symbol = new AnonSymbol();
            fresh.put(generator.symbol(), symbol);
            newSymbols.add(symbol);
            logger.debug("Renaming {} to {} in {}", generator.symbol(), symbol, node);
        }

        List<Node> children = node.children();
        List<Node> newChildren = new ArrayList<>(children.size());
        boolean changed = false;
        for (int i = 0; i < children.size(); i++) {
            Map<Symbol, Symbol> childEnv = env;
            List<Symbol> visible = def.symbolsInScope(i);
            if (!visible.isEmpty()) {
                childEnv = new HashMap<>(env);
                for (Symbol symbol : visible) {
                    childEnv.put(symbol, fresh.get(symbol));
                }
            }
            Node child = children.get(i);
            Node transformed = transform(child, childEnv);
            changed |= transformed != child;
            newChildren.add(transformed);
        }

        Node withChildren = changed ? node.rebuild(newChildren) : node;
        return ((DefNode) withChildren).rebuildWithGenerators(newSymbols);
    }
}
