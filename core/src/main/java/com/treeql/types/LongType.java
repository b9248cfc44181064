package com.treeql.types;

/**
 * Data type representing a 64-bit signed integer, as produced by sequences and row numbering.
 */
public final class LongType implements DataType {

    private static final LongType INSTANCE = new LongType();

    private LongType() {}

    public static LongType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "long";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof LongType;
    }

    @Override
    public int hashCode() {
        return typeName().hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
