package com.treeql.ast;

import java.util.Objects;

/**
 * An infinite, ascending stream of consecutive numbers starting at
 * {@link #start()}.
 *
 * <p>It only appears as the right side of a {@link JoinType#ZIP zip join} to
 * number the rows of the left side, because it has no stand-alone SQL form.
 */
public final class RangeFrom extends NullaryNode {

    private final long start;

    public RangeFrom(long start) {
        this.start = start;
    }

    /**
     * Creates a range starting at 1.
     */
    public RangeFrom() {
        this(1L);
    }

    public long start() {
        return start;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof RangeFrom && ((RangeFrom) obj).start == start;
    }

    @Override
    public int hashCode() {
        return Objects.hash("RangeFrom", start);
    }

    @Override
    public String toString() {
        return "RangeFrom " + start;
    }
}
