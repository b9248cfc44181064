package com.treeql.ast;

import com.treeql.symbol.Symbol;
import com.treeql.types.DataType;
import java.util.List;
import java.util.Objects;

/**
 * A function call with a known result type.
 */
public final class TypedApply extends Apply implements TypedNode {

    private final DataType dataType;

    public TypedApply(Symbol symbol, List<? extends Node> arguments, DataType dataType) {
        super(symbol, arguments);
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    protected Node nodeRebuild(List<Node> newChildren) {
        return new TypedApply(symbol(), newChildren, dataType);
    }

    @Override
    public Node rebuildWithReference(Symbol newSymbol) {
        return new TypedApply(newSymbol, children(), dataType);
    }

    @Override
    public boolean equals(Object obj) {
        return super.equals(obj) && dataType.equals(((TypedApply) obj).dataType);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + dataType.hashCode();
    }

    @Override
    public String toString() {
        return super.toString() + " : " + dataType;
    }
}
