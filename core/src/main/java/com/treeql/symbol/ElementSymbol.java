package com.treeql.symbol;

/**
 * A symbol selecting the element at a 1-based position of a product.
 */
public record ElementSymbol(int index) implements Symbol {

    public ElementSymbol {
        if (index < 1) {
            throw new IllegalArgumentException("index must be positive: " + index);
        }
    }

    @Override
    public String name() {
        return "_" + index;
    }

    @Override
    public String toString() {
        return name();
    }
}
