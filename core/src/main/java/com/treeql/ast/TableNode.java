package com.treeql.ast;

import com.treeql.symbol.TableSymbol;

/**
 * Base class for raw table entities.
 *
 * <p>Table nodes are created by the query-building layer, which subclasses this
 * type with its own table descriptions. A raw table cannot have its fields
 * selected directly: it must first be bound to a generator through a
 * {@link TableExpansion} (see {@link Select}).
 *
 * <p>Subclasses must keep the value semantics of nodes and implement
 * {@code equals}/{@code hashCode} over their attributes.
 */
public abstract non-sealed class TableNode extends NullaryNode {

    /**
     * Returns the name of the table.
     *
     * @return the table name
     */
    public abstract String tableName();

    /**
     * Returns the symbol naming this table.
     *
     * @return a table symbol with this table's name
     */
    public TableSymbol tableSymbol() {
        return new TableSymbol(tableName());
    }

    @Override
    public String toString() {
        return "Table " + tableName();
    }
}
