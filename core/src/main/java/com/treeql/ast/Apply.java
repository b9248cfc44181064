package com.treeql.ast;

import com.treeql.symbol.Symbol;
import com.treeql.types.DataType;
import java.util.List;
import java.util.Objects;

/**
 * Applies a function or operator, identified by {@link #symbol()}, to its
 * arguments.
 *
 * <p>Once the type checker has run, calls are represented by
 * {@link TypedApply}, which keeps its type through rebuilds.
 */
public sealed class Apply extends Node implements RefNode permits TypedApply {

    private final Symbol symbol;
    private final List<Node> arguments;

    public Apply(Symbol symbol, List<? extends Node> arguments) {
        this.symbol = Objects.requireNonNull(symbol, "symbol must not be null");
        this.arguments = List.copyOf(Objects.requireNonNull(arguments, "arguments must not be null"));
    }

    /**
     * Creates a typed function call.
     *
     * @param symbol the function symbol
     * @param arguments the arguments
     * @param dataType the result type
     * @return the typed call
     */
    public static TypedApply typed(Symbol symbol, List<? extends Node> arguments, DataType dataType) {
        return new TypedApply(symbol, arguments, dataType);
    }

    public Symbol symbol() {
        return symbol;
    }

    @Override
    public List<Node> children() {
        return arguments;
    }

    @Override
    protected Node nodeRebuild(List<Node> newChildren) {
        return new Apply(symbol, newChildren);
    }

    @Override
    public Symbol reference() {
        return symbol;
    }

    @Override
    public Node rebuildWithReference(Symbol newSymbol) {
        return new Apply(newSymbol, arguments);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || obj.getClass() != getClass()) return false;
        Apply that = (Apply) obj;
        return symbol.equals(that.symbol) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash("Apply", symbol, arguments);
    }

    @Override
    public String toString() {
        return "Apply " + symbol;
    }
}
