package com.treeql.types;

import java.util.Objects;

/**
 * Placeholder type for nodes built before type inference has run.
 *
 * <p>The hint records what kind of value is waiting for a type, which makes tree
 * dumps of untyped trees easier to read.
 *
 * @see DataType
 */
public final class UnresolvedType implements DataType {

    private final String hint;

    /**
     * Creates an UnresolvedType with a hint describing what type is expected.
     *
     * @param hint a descriptive hint (e.g., "null_literal", "field")
     */
    public UnresolvedType(String hint) {
        this.hint = Objects.requireNonNull(hint, "hint must not be null");
    }

    public UnresolvedType() {
        this("unknown");
    }

    public String hint() {
        return hint;
    }

    @Override
    public String typeName() {
        return "unresolved(" + hint + ")";
    }

    @Override
    public boolean isResolved() {
        return false;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof UnresolvedType)) return false;
        return hint.equals(((UnresolvedType) other).hint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hint);
    }

    @Override
    public String toString() {
        return typeName();
    }

    // ==================== Factory Methods ====================

    /**
     * Type of a {@code null} literal before inference.
     */
    public static UnresolvedType nullLiteral() {
        return new UnresolvedType("null_literal");
    }

    /**
     * Type of a field whose column type is not known yet.
     */
    public static UnresolvedType field() {
        return new UnresolvedType("field");
    }
}
