package com.treeql.ast;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * A tuple of values. Its elements are addressed by position, starting at 1
 * (see {@link com.treeql.symbol.ElementSymbol}).
 */
public final class ProductNode extends Node {

    private final List<Node> elements;

    public ProductNode(List<? extends Node> elements) {
        this.elements = List.copyOf(Objects.requireNonNull(elements, "elements must not be null"));
    }

    public ProductNode(Node... elements) {
        this(List.of(elements));
    }

    @Override
    public List<Node> children() {
        return elements;
    }

    @Override
    public List<String> childNames() {
        return IntStream.rangeClosed(1, elements.size())
            .mapToObj(Integer::toString)
            .collect(Collectors.toUnmodifiableList());
    }

    @Override
    protected Node nodeRebuild(List<Node> newChildren) {
        return new ProductNode(newChildren);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ProductNode)) return false;
        return elements.equals(((ProductNode) obj).elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash("ProductNode", elements);
    }

    @Override
    public String toString() {
        return "ProductNode";
    }
}
