package com.treeql.ast;

import java.util.Objects;

/**
 * Direction and null placement of one sort key.
 *
 * <p>The default is ascending with the database's default null placement.
 */
public record Ordering(Direction direction, NullOrdering nulls) {

    /** Ascending, default null placement. */
    public static final Ordering DEFAULT = new Ordering(Direction.ASC, NullOrdering.NULLS_DEFAULT);

    public Ordering {
        Objects.requireNonNull(direction, "direction must not be null");
        Objects.requireNonNull(nulls, "nulls must not be null");
    }

    public Ordering asc() {
        return new Ordering(Direction.ASC, nulls);
    }

    public Ordering desc() {
        return new Ordering(Direction.DESC, nulls);
    }

    /**
     * Flips the direction. Null placement is kept.
     *
     * @return the reversed ordering
     */
    public Ordering reverse() {
        return new Ordering(direction.reverse(), nulls);
    }

    public Ordering nullsDefault() {
        return new Ordering(direction, NullOrdering.NULLS_DEFAULT);
    }

    public Ordering nullsFirst() {
        return new Ordering(direction, NullOrdering.NULLS_FIRST);
    }

    public Ordering nullsLast() {
        return new Ordering(direction, NullOrdering.NULLS_LAST);
    }

    @Override
    public String toString() {
        switch (nulls) {
            case NULLS_FIRST:
                return direction + " nullsFirst";
            case NULLS_LAST:
                return direction + " nullsLast";
            default:
                return direction.toString();
        }
    }

    /**
     * Sort direction.
     */
    public enum Direction {
        ASC(false),
        DESC(true);

        private final boolean desc;

        Direction(boolean desc) {
            this.desc = desc;
        }

        public boolean isDesc() {
            return desc;
        }

        public Direction reverse() {
            return desc ? ASC : DESC;
        }

        @Override
        public String toString() {
            return desc ? "desc" : "asc";
        }
    }

    /**
     * Null placement.
     */
    public enum NullOrdering {
        NULLS_DEFAULT(false, false),
        NULLS_FIRST(true, false),
        NULLS_LAST(false, true);

        private final boolean first;
        private final boolean last;

        NullOrdering(boolean first, boolean last) {
            this.first = first;
            this.last = last;
        }

        public boolean first() {
            return first;
        }

        public boolean last() {
            return last;
        }
    }
}
