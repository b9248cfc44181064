package com.treeql.symbol;

import com.treeql.ast.Node;
import java.util.Objects;

/**
 * A symbol derived from the identity of a node instance.
 *
 * <p>It lets a node act as its own implicit binder without introducing a
 * separately named symbol. Two intrinsic symbols are equal iff they wrap the
 * same node instance. Structurally equal but distinct nodes produce distinct
 * symbols.
 *
 * @see Node#intrinsicSymbol()
 */
public final class IntrinsicSymbol implements Symbol {

    private final Node target;

    public IntrinsicSymbol(Node target) {
        this.target = Objects.requireNonNull(target, "target must not be null");
    }

    /**
     * Returns the node this symbol was derived from.
     *
     * @return the target node
     */
    public Node target() {
        return target;
    }

    @Override
    public String name() {
        return "/" + System.identityHashCode(target);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof IntrinsicSymbol && ((IntrinsicSymbol) obj).target == target;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(target);
    }

    @Override
    public String toString() {
        return name();
    }
}
