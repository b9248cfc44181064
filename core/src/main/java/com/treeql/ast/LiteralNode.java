package com.treeql.ast;

import com.treeql.types.BooleanType;
import com.treeql.types.DataType;
import com.treeql.types.DoubleType;
import com.treeql.types.IntegerType;
import com.treeql.types.LongType;
import com.treeql.types.StringType;
import com.treeql.types.UnresolvedType;
import java.util.Objects;

/**
 * A constant value.
 *
 * <p>Two literals are equal iff their values and their types are equal.
 */
public final class LiteralNode extends NullaryNode implements TypedNode {

    private final Object value;
    private final DataType dataType;

    /**
     * Creates a literal.
     *
     * @param value the literal value (may be null)
     * @param dataType the type of the literal
     */
    public LiteralNode(Object value, DataType dataType) {
        this.value = value;
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
    }

    /**
     * Returns the literal value.
     *
     * @return the value, or null for NULL literals
     */
    public Object value() {
        return value;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    public boolean isNull() {
        return value == null;
    }

    /**
     * Returns whether this is the constant {@code true}. Only the value is
     * checked, so a {@code true} whose type has not been inferred yet counts.
     *
     * @return true iff the value is {@link Boolean#TRUE}
     */
    public boolean isTrue() {
        return Boolean.TRUE.equals(value);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof LiteralNode)) return false;
        LiteralNode that = (LiteralNode) obj;
        return Objects.equals(value, that.value) &&
               dataType.equals(that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, dataType);
    }

    @Override
    public String toString() {
        return "LiteralNode " + (value instanceof String ? "\"" + value + "\"" : String.valueOf(value));
    }

    // ==================== Factory Methods ====================

    public static LiteralNode of(boolean value) {
        return new LiteralNode(value, BooleanType.get());
    }

    public static LiteralNode of(int value) {
        return new LiteralNode(value, IntegerType.get());
    }

    public static LiteralNode of(long value) {
        return new LiteralNode(value, LongType.get());
    }

    public static LiteralNode of(double value) {
        return new LiteralNode(value, DoubleType.get());
    }

    public static LiteralNode of(String value) {
        return new LiteralNode(Objects.requireNonNull(value, "value must not be null"), StringType.get());
    }

    /**
     * Creates a NULL literal whose type is still to be inferred.
     *
     * @return the null literal
     */
    public static LiteralNode ofNull() {
        return new LiteralNode(null, UnresolvedType.nullLiteral());
    }
}
