package com.treeql.symbol;

import com.treeql.types.DataType;
import com.treeql.types.UnresolvedType;
import java.util.Objects;

/**
 * A symbol naming a column of a table or a field of a record.
 *
 * <p>Field symbols are the selectors of {@code Select} nodes. They are not
 * bindings and are never alpha-renamed.
 */
public record FieldSymbol(String name, DataType dataType) implements Symbol {

    public FieldSymbol {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(dataType, "dataType must not be null");
    }

    /**
     * Creates a field symbol whose type has not been inferred yet.
     *
     * @param name the field name
     * @return the field symbol
     */
    public static FieldSymbol of(String name) {
        return new FieldSymbol(name, UnresolvedType.field());
    }

    @Override
    public String toString() {
        return name;
    }
}
