package com.treeql.symbol;

import java.util.Objects;

/**
 * A symbol naming a database table. Two table symbols are equal iff their
 * names are equal.
 */
public record TableSymbol(String name) implements Symbol {

    public TableSymbol {
        Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public String toString() {
        return name;
    }
}
