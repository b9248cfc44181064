package com.treeql.ast;

import java.util.List;
import java.util.Objects;

/**
 * One clause of a {@link ConditionalExpr}: if {@code condition} holds, the
 * result is {@code result}.
 */
public final class IfThen extends BinaryNode {

    private final Node condition;
    private final Node result;

    public IfThen(Node condition, Node result) {
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
        this.result = Objects.requireNonNull(result, "result must not be null");
    }

    public Node condition() {
        return condition;
    }

    public Node result() {
        return result;
    }

    @Override
    public Node left() {
        return condition;
    }

    @Override
    public Node right() {
        return result;
    }

    @Override
    public List<String> childNames() {
        return List.of("if", "then");
    }

    @Override
    protected Node rebuild(Node left, Node right) {
        return new IfThen(left, right);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof IfThen)) return false;
        IfThen that = (IfThen) obj;
        return condition.equals(that.condition) && result.equals(that.result);
    }

    @Override
    public int hashCode() {
        return Objects.hash("IfThen", condition, result);
    }

    @Override
    public String toString() {
        return "IfThen";
    }
}
