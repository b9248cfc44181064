package com.treeql.ast;

import com.treeql.symbol.Symbol;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Sorts the rows of {@code from} by its keys. A sort without keys leaves the
 * rows in source order.
 *
 * <p>The children are the source followed by one child per key, in key order.
 * The keys refer to the current row through {@link #generator()}.
 */
public final class SortBy extends Node implements FilteredQuery {

    private final Symbol generator;
    private final Node from;
    private final List<SortKey> by;

    /**
     * Creates a sort node.
     *
     * @param generator the symbol naming a source row
     * @param from the source collection
     * @param by the sort keys, most significant first, possibly empty
     */
    public SortBy(Symbol generator, Node from, List<SortKey> by) {
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.from = Objects.requireNonNull(from, "from must not be null");
        this.by = List.copyOf(Objects.requireNonNull(by, "by must not be null"));
    }

    @Override
    public Symbol generator() {
        return generator;
    }

    @Override
    public Node from() {
        return from;
    }

    /**
     * Returns the sort keys.
     *
     * @return an unmodifiable list of keys
     */
    public List<SortKey> by() {
        return by;
    }

    @Override
    public List<Node> children() {
        List<Node> children = new ArrayList<>(by.size() + 1);
        children.add(from);
        for (SortKey key : by) {
            children.add(key.key());
        }
        return List.copyOf(children);
    }

    @Override
    public List<String> childNames() {
        List<String> names = new ArrayList<>(by.size() + 1);
        names.add("from " + generator);
        for (int i = 0; i < by.size(); i++) {
            names.add("by" + i);
        }
        return List.copyOf(names);
    }

    @Override
    protected Node nodeRebuild(List<Node> newChildren) {
        List<SortKey> keys = new ArrayList<>(by.size());
        for (int i = 0; i < by.size(); i++) {
            keys.add(new SortKey(newChildren.get(i + 1), by.get(i).ordering()));
        }
        return new SortBy(generator, newChildren.get(0), keys);
    }

    @Override
    public Node rebuildWithGenerators(List<Symbol> symbols) {
        DefNode.checkGeneratorCount(this, symbols);
        return new SortBy(symbols.get(0), from, by);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SortBy)) return false;
        SortBy that = (SortBy) obj;
        return generator.equals(that.generator) &&
               from.equals(that.from) &&
               by.equals(that.by);
    }

    @Override
    public int hashCode() {
        return Objects.hash("SortBy", generator, from, by);
    }

    @Override
    public String toString() {
        if (by.isEmpty()) {
            return "SortBy";
        }
        return "SortBy " + by.stream()
            .map(k -> k.ordering().toString())
            .collect(Collectors.joining(", "));
    }

    /**
     * A sort key expression with its ordering.
     */
    public record SortKey(Node key, Ordering ordering) {

        public SortKey {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(ordering, "ordering must not be null");
        }

        /**
         * Creates a key with the default ordering.
         *
         * @param key the key expression
         * @return the sort key
         */
        public static SortKey of(Node key) {
            return new SortKey(key, Ordering.DEFAULT);
        }
    }
}
