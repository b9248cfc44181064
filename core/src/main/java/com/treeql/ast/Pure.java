package com.treeql.ast;

import java.util.List;
import java.util.Objects;

/**
 * Lifts a scalar value into a collection with exactly one row.
 */
public final class Pure extends UnaryNode {

    private final Node value;

    public Pure(Node value) {
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public Node value() {
        return value;
    }

    @Override
    public Node child() {
        return value;
    }

    @Override
    public List<String> childNames() {
        return List.of("value");
    }

    @Override
    protected Node rebuild(Node child) {
        return new Pure(child);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Pure)) return false;
        return value.equals(((Pure) obj).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash("Pure", value);
    }

    @Override
    public String toString() {
        return "Pure";
    }
}
