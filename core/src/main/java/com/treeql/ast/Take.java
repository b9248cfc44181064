package com.treeql.ast;

import com.treeql.symbol.AnonSymbol;
import com.treeql.symbol.Symbol;
import java.util.List;
import java.util.Objects;

/**
 * Bounds its source to the first {@code count} rows.
 *
 * <p>The generator names a row of the source. It is allocated freshly when the
 * caller does not supply one.
 */
public final class Take extends UnaryNode implements FilteredQuery {

    private final Node from;
    private final long count;
    private final Symbol generator;

    /**
     * Creates a take node.
     *
     * @param from the source collection
     * @param count the number of rows, must not be negative
     * @param generator the symbol naming a source row
     */
    public Take(Node from, long count, Symbol generator) {
        this.from = Objects.requireNonNull(from, "from must not be null");
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative, got: " + count);
        }
        this.count = count;
    }

    /**
     * Creates a take node with a fresh anonymous generator.
     *
     * @param from the source collection
     * @param count the number of rows, must not be negative
     */
    public Take(Node from, long count) {
        this(from, count, new AnonSymbol());
    }

    @Override
    public Node from() {
        return from;
    }

    public long count() {
        return count;
    }

    @Override
    public Symbol generator() {
        return generator;
    }

    @Override
    public Node child() {
        return from;
    }

    @Override
    public List<String> childNames() {
        return List.of("from " + generator);
    }

    @Override
    protected Node rebuild(Node child) {
        return new Take(child, count, generator);
    }

    @Override
    public Node rebuildWithGenerators(List<Symbol> symbols) {
        DefNode.checkGeneratorCount(this, symbols);
        return new Take(from, count, symbols.get(0));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Take)) return false;
        Take that = (Take) obj;
        return count == that.count &&
               generator.equals(that.generator) &&
               from.equals(that.from);
    }

    @Override
    public int hashCode() {
        return Objects.hash("Take", from, count, generator);
    }

    @Override
    public String toString() {
        return "Take " + count;
    }
}
