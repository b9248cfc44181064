package com.treeql.ast;

import com.treeql.symbol.Symbol;
import java.util.Objects;

/**
 * A symbol introduced by a {@link DefNode}, together with the node whose rows
 * the symbol ranges over.
 */
public record Generator(Symbol symbol, Node source) {

    public Generator {
        Objects.requireNonNull(symbol, "symbol must not be null");
        Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public String toString() {
        return symbol + " <- " + source;
    }
}
