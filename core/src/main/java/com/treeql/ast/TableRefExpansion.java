package com.treeql.ast;

import com.treeql.symbol.Symbol;
import java.util.List;
import java.util.Objects;

/**
 * Like {@link TableExpansion}, but replaces a {@link Ref} that points to an
 * already expanded table instead of a raw table.
 *
 * <p>{@code marker} identifies the expansion and is bound over the reference.
 */
public final class TableRefExpansion extends BinaryNode implements DefNode {

    private final Symbol marker;
    private final Node ref;
    private final Node columns;

    public TableRefExpansion(Symbol marker, Node ref, Node columns) {
        this.marker = Objects.requireNonNull(marker, "marker must not be null");
        this.ref = Objects.requireNonNull(ref, "ref must not be null");
        this.columns = Objects.requireNonNull(columns, "columns must not be null");
    }

    public Symbol marker() {
        return marker;
    }

    public Node ref() {
        return ref;
    }

    public Node columns() {
        return columns;
    }

    @Override
    public Node left() {
        return ref;
    }

    @Override
    public Node right() {
        return columns;
    }

    @Override
    public List<String> childNames() {
        return List.of("ref", "columns");
    }

    @Override
    protected Node rebuild(Node left, Node right) {
        return new TableRefExpansion(marker, left, right);
    }

    @Override
    public List<Generator> generators() {
        return List.of(new Generator(marker, ref));
    }

    @Override
    public Node rebuildWithGenerators(List<Symbol> symbols) {
        DefNode.checkGeneratorCount(this, symbols);
        return new TableRefExpansion(symbols.get(0), ref, columns);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TableRefExpansion)) return false;
        TableRefExpansion that = (TableRefExpansion) obj;
        return marker.equals(that.marker) &&
               ref.equals(that.ref) &&
               columns.equals(that.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash("TableRefExpansion", marker, ref, columns);
    }

    @Override
    public String toString() {
        return "TableRefExpansion " + marker;
    }
}
