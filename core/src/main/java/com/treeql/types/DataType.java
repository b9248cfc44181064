package com.treeql.types;

/**
 * Sealed interface for the result types attached to typed tree nodes.
 *
 * <p>The query tree does not check types itself. A type-inference pass outside
 * this library computes them and attaches them through
 * {@link com.treeql.ast.TypedNode}. Code generators then read them back.
 *
 * <p>Available types:
 * <ul>
 *   <li>Primitive types: BooleanType, IntegerType, LongType, DoubleType, StringType</li>
 *   <li>UnresolvedType for values whose type has not been inferred yet</li>
 * </ul>
 */
public sealed interface DataType
    permits BooleanType, IntegerType, LongType, DoubleType, StringType, UnresolvedType {

    /**
     * Returns the name of this type as it appears in tree dumps.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Returns whether this type is a concrete, inferred type.
     *
     * @return false only for {@link UnresolvedType}
     */
    default boolean isResolved() {
        return true;
    }
}
