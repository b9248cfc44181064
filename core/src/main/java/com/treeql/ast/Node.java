package com.treeql.ast;

import com.treeql.symbol.IntrinsicSymbol;
import com.treeql.util.MapUtils;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Base class for all nodes of the query tree.
 *
 * <p>A node is an immutable value. It exposes its children in a fixed order and
 * can be rebuilt with a replacement list of children of the same length. All
 * rewriting goes through {@link #mapChildren(UnaryOperator)}. That method
 * returns this very instance when the mapping changes no child, so repeated
 * optimizer passes do not reallocate untouched subtrees.
 *
 * <p>Equality is structural. Two nodes are equal iff they are of the same kind,
 * carry equal attributes and have pairwise equal children. Reference identity
 * is only used as a shortcut to detect "no change" while rewriting.
 *
 * <p>The hierarchy is closed. Every node kind is listed below, and only
 * {@link TableNode} may be extended outside this package because table
 * entities are supplied by the query-building layer.
 *
 * <p>Every kind is a combination of one shape ({@link NullaryNode},
 * {@link UnaryNode}, {@link BinaryNode} or variadic), optionally
 * {@link TypedNode}, and optionally one binding capability ({@link DefNode} or
 * {@link RefNode}).
 */
public abstract sealed class Node implements NodeGenerator
    permits NullaryNode, UnaryNode, BinaryNode, ProductNode, StructNode, SortBy,
            Join, Apply, LetDynamic, ConditionalExpr {

    /**
     * Returns the children of this node.
     *
     * <p>The order is significant and stable across calls.
     *
     * @return an unmodifiable list of children, possibly empty
     */
    public abstract List<Node> children();

    /**
     * Returns display names for the children, used in tree dumps.
     *
     * <p>Defaults to the positional index of each child.
     *
     * @return one name per child
     */
    public List<String> childNames() {
        return IntStream.range(0, children().size())
            .mapToObj(Integer::toString)
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Creates a node of the same kind and with the same attributes, but with
     * the given children.
     *
     * @param newChildren the replacement children, exactly as many as {@link #children()}
     * @return the rebuilt node
     * @throws AssertionError if the number of children does not match
     */
    public final Node rebuild(List<? extends Node> newChildren) {
        Objects.requireNonNull(newChildren, "newChildren must not be null");
        int expected = children().size();
        if (newChildren.size() != expected) {
            throw new AssertionError(String.format(
                "%s expects %d children for rebuild, got %d",
                getClass().getSimpleName(), expected, newChildren.size()));
        }
        return nodeRebuild(List.copyOf(newChildren));
    }

    /**
     * Kind-specific rebuild. The arity has already been checked.
     *
     * @param newChildren the replacement children
     * @return the rebuilt node
     */
    protected abstract Node nodeRebuild(List<Node> newChildren);

    /**
     * Applies a function to all children and rebuilds this node with the
     * results.
     *
     * @param f the mapping function
     * @return this instance if every child was mapped to itself, otherwise a rebuilt node
     */
    public final Node mapChildren(UnaryOperator<Node> f) {
        return MapUtils.mapOrNone(children(), f)
            .map(this::nodeRebuild)
            .orElse(this);
    }

    /**
     * Returns the node that should be used in place of this one.
     *
     * <p>Kinds that can simplify themselves (such as a filter with a constant
     * {@code true} predicate) return a different node here. Delegates are not
     * followed implicitly. They are applied by {@link Nodes#resolve(Node)} and
     * by the {@code ResolveDelegates} optimizer rule.
     *
     * @return the delegate, this node by default
     */
    @Override
    public Node delegate() {
        return this;
    }

    /**
     * Returns a symbol that stands for this node instance.
     *
     * @return a new intrinsic symbol, equal to any other intrinsic symbol of this instance
     */
    public final IntrinsicSymbol intrinsicSymbol() {
        return new IntrinsicSymbol(this);
    }

    /**
     * Returns the kind name followed by the non-child attributes of this node.
     * Children are not included, see {@link TreeDump} for a full rendering.
     *
     * @return the node description
     */
    @Override
    public abstract String toString();
}
