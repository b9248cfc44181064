package com.treeql.ast;

import com.treeql.symbol.Symbol;
import java.util.List;
import java.util.Objects;

/**
 * Keeps the rows of {@code from} for which {@code where} holds. The predicate
 * refers to the current row through {@link #generator()}.
 *
 * <p>A filter whose predicate is the literal {@code true} delegates to its
 * source.
 */
public final class Filter extends BinaryNode implements FilteredQuery {

    private final Symbol generator;
    private final Node from;
    private final Node where;

    public Filter(Symbol generator, Node from, Node where) {
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.from = Objects.requireNonNull(from, "from must not be null");
        this.where = Objects.requireNonNull(where, "where must not be null");
    }

    @Override
    public Symbol generator() {
        return generator;
    }

    @Override
    public Node from() {
        return from;
    }

    public Node where() {
        return where;
    }

    @Override
    public Node left() {
        return from;
    }

    @Override
    public Node right() {
        return where;
    }

    @Override
    public List<String> childNames() {
        return List.of("from " + generator, "where");
    }

    @Override
    protected Node rebuild(Node left, Node right) {
        return new Filter(generator, left, right);
    }

    @Override
    public Node rebuildWithGenerators(List<Symbol> symbols) {
        DefNode.checkGeneratorCount(this, symbols);
        return new Filter(symbols.get(0), from, where);
    }

    @Override
    public Node delegate() {
        if (where instanceof LiteralNode && ((LiteralNode) where).isTrue()) {
            return from;
        }
        return this;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Filter)) return false;
        Filter that = (Filter) obj;
        return generator.equals(that.generator) &&
               from.equals(that.from) &&
               where.equals(that.where);
    }

    @Override
    public int hashCode() {
        return Objects.hash("Filter", generator, from, where);
    }

    @Override
    public String toString() {
        return "Filter";
    }
}
