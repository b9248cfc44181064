package com.treeql.ast;

import com.treeql.symbol.Symbol;
import java.util.function.UnaryOperator;

/**
 * Capability of nodes that reference exactly one symbol: a bound variable
 * ({@link Ref}), a field ({@link Select}) or a function ({@link Apply}).
 */
public sealed interface RefNode permits Ref, Select, Apply {

    /**
     * Returns the referenced symbol.
     *
     * @return the symbol
     */
    Symbol reference();

    /**
     * Rebuilds this node with a different referenced symbol.
     *
     * @param symbol the new symbol
     * @return the rebuilt node
     */
    Node rebuildWithReference(Symbol symbol);

    /**
     * Applies a function to the referenced symbol.
     *
     * @param f the renaming function
     * @return this node if the symbol was mapped to itself, otherwise a rebuilt node
     */
    default Node mapReference(UnaryOperator<Symbol> f) {
        Symbol current = reference();
        Symbol mapped = f.apply(current);
        return mapped == current ? (Node) this : rebuildWithReference(mapped);
    }
}
