package com.treeql.ast;

import com.treeql.symbol.Symbol;
import java.util.Objects;

/**
 * A reference to a bound symbol, usually the generator of an enclosing
 * binding node.
 */
public final class Ref extends NullaryNode implements RefNode {

    private final Symbol symbol;

    public Ref(Symbol symbol) {
        this.symbol = Objects.requireNonNull(symbol, "symbol must not be null");
    }

    public Symbol symbol() {
        return symbol;
    }

    @Override
    public Symbol reference() {
        return symbol;
    }

    @Override
    public Node rebuildWithReference(Symbol newSymbol) {
        return new Ref(newSymbol);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Ref)) return false;
        return symbol.equals(((Ref) obj).symbol);
    }

    @Override
    public int hashCode() {
        return Objects.hash("Ref", symbol);
    }

    @Override
    public String toString() {
        return "Ref " + symbol;
    }
}
