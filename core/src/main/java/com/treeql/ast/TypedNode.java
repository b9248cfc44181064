package com.treeql.ast;

import com.treeql.types.DataType;

/**
 * A node that carries its result type.
 *
 * <p>This library only stores the type. It is computed by a type-inference pass
 * outside the library and is never validated here.
 */
public interface TypedNode {

    /**
     * Returns the result type of this node.
     *
     * @return the data type
     */
    DataType dataType();
}
