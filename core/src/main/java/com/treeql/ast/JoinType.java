package com.treeql.ast;

/**
 * Kind of a {@link Join}.
 */
public enum JoinType {
    INNER("inner"),
    LEFT("left outer"),
    RIGHT("right outer"),
    OUTER("full outer"),
    /** Pairs rows by position. Used with {@link RangeFrom} to number rows. */
    ZIP("zip");

    private final String sqlName;

    JoinType(String sqlName) {
        this.sqlName = sqlName;
    }

    /**
     * Returns the name used for this join kind in SQL and in tree dumps.
     *
     * @return the SQL name, e.g. {@code "left outer"}
     */
    public String sqlName() {
        return sqlName;
    }
}
