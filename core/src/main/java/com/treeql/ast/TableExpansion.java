package com.treeql.ast;

import com.treeql.symbol.Symbol;
import java.util.List;
import java.util.Objects;

/**
 * Captures both views of a table during compilation: the table as a single
 * row entity, bound to {@code generator}, and the structure of its columns.
 *
 * <p>Table expansions are introduced by a table-expansion phase and removed
 * again once paths into the table have been rewritten. The column structure
 * usually selects fields from a {@link Ref} to the generator.
 */
public final class TableExpansion extends BinaryNode implements DefNode {

    private final Symbol generator;
    private final Node table;
    private final Node columns;

    public TableExpansion(Symbol generator, Node table, Node columns) {
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.columns = Objects.requireNonNull(columns, "columns must not be null");
    }

    public Symbol generator() {
        return generator;
    }

    public Node table() {
        return table;
    }

    public Node columns() {
        return columns;
    }

    @Override
    public Node left() {
        return table;
    }

    @Override
    public Node right() {
        return columns;
    }

    @Override
    public List<String> childNames() {
        return List.of("table " + generator, "columns");
    }

    @Override
    protected Node rebuild(Node left, Node right) {
        return new TableExpansion(generator, left, right);
    }

    @Override
    public List<Generator> generators() {
        return List.of(new Generator(generator, table));
    }

    @Override
    public Node rebuildWithGenerators(List<Symbol> symbols) {
        DefNode.checkGeneratorCount(this, symbols);
        return new TableExpansion(symbols.get(0), table, columns);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TableExpansion)) return false;
        TableExpansion that = (TableExpansion) obj;
        return generator.equals(that.generator) &&
               table.equals(that.table) &&
               columns.equals(that.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash("TableExpansion", generator, table, columns);
    }

    @Override
    public String toString() {
        return "TableExpansion";
    }
}
