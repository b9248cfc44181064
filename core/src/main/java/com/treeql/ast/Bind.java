package com.treeql.ast;

import com.treeql.symbol.Symbol;
import java.util.List;
import java.util.Objects;

/**
 * Monadic bind (flat-map): for every row of {@code from}, bound to
 * {@code generator}, evaluates {@code select} and concatenates the results.
 */
public final class Bind extends BinaryNode implements DefNode {

    private final Symbol generator;
    private final Node from;
    private final Node select;

    public Bind(Symbol generator, Node from, Node select) {
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.from = Objects.requireNonNull(from, "from must not be null");
        this.select = Objects.requireNonNull(select, "select must not be null");
    }

    public Symbol generator() {
        return generator;
    }

    public Node from() {
        return from;
    }

    public Node select() {
        return select;
    }

    @Override
    public Node left() {
        return from;
    }

    @Override
    public Node right() {
        return select;
    }

    @Override
    public List<String> childNames() {
        return List.of("from " + generator, "select");
    }

    @Override
    protected Node rebuild(Node left, Node right) {
        return new Bind(generator, left, right);
    }

    @Override
    public List<Generator> generators() {
        return List.of(new Generator(generator, from));
    }

    @Override
    public Node rebuildWithGenerators(List<Symbol> symbols) {
        DefNode.checkGeneratorCount(this, symbols);
        return new Bind(symbols.get(0), from, select);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Bind)) return false;
        Bind that = (Bind) obj;
        return generator.equals(that.generator) &&
               from.equals(that.from) &&
               select.equals(that.select);
    }

    @Override
    public int hashCode() {
        return Objects.hash("Bind", generator, from, select);
    }

    @Override
    public String toString() {
        return "Bind";
    }
}
