package com.treeql.ast;

import com.treeql.symbol.Symbol;
import java.util.List;
import java.util.Objects;

/**
 * Groups the rows of {@code from} by the key computed by {@code by}.
 *
 * <p>{@code fromGen} names a source row and is visible in the key expression.
 * {@code byGen} names a computed key.
 */
public final class GroupBy extends BinaryNode implements DefNode {

    private final Symbol fromGen;
    private final Symbol byGen;
    private final Node from;
    private final Node by;

    public GroupBy(Symbol fromGen, Symbol byGen, Node from, Node by) {
        this.fromGen = Objects.requireNonNull(fromGen, "fromGen must not be null");
        this.byGen = Objects.requireNonNull(byGen, "byGen must not be null");
        this.from = Objects.requireNonNull(from, "from must not be null");
        this.by = Objects.requireNonNull(by, "by must not be null");
    }

    public Symbol fromGen() {
        return fromGen;
    }

    public Symbol byGen() {
        return byGen;
    }

    public Node from() {
        return from;
    }

    public Node by() {
        return by;
    }

    @Override
    public Node left() {
        return from;
    }

    @Override
    public Node right() {
        return by;
    }

    @Override
    public List<String> childNames() {
        return List.of("from " + fromGen, "by " + byGen);
    }

    @Override
    protected Node rebuild(Node left, Node right) {
        return new GroupBy(fromGen, byGen, left, right);
    }

    @Override
    public List<Generator> generators() {
        return List.of(new Generator(fromGen, from), new Generator(byGen, by));
    }

    @Override
    public Node rebuildWithGenerators(List<Symbol> symbols) {
        DefNode.checkGeneratorCount(this, symbols);
        return new GroupBy(symbols.get(0), symbols.get(1), from, by);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof GroupBy)) return false;
        GroupBy that = (GroupBy) obj;
        return fromGen.equals(that.fromGen) &&
               byGen.equals(that.byGen) &&
               from.equals(that.from) &&
               by.equals(that.by);
    }

    @Override
    public int hashCode() {
        return Objects.hash("GroupBy", fromGen, byGen, from, by);
    }

    @Override
    public String toString() {
        return "GroupBy";
    }
}
