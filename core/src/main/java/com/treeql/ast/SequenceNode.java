package com.treeql.ast;

import java.util.Objects;

/**
 * An external database sequence, used to draw generated numbers.
 *
 * <p>The increment is informational and does not take part in equality.
 */
public final class SequenceNode extends NullaryNode {

    private final String name;
    private final long increment;

    public SequenceNode(String name, long increment) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.increment = increment;
    }

    public SequenceNode(String name) {
        this(name, 1L);
    }

    public String name() {
        return name;
    }

    public long increment() {
        return increment;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SequenceNode)) return false;
        return name.equals(((SequenceNode) obj).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash("SequenceNode", name);
    }

    @Override
    public String toString() {
        return "SequenceNode " + name;
    }
}
