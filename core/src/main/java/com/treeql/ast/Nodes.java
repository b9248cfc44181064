package com.treeql.ast;

import com.treeql.exception.NodeNarrowingException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Static helpers for building and traversing query trees.
 *
 * <p>All traversals are built on {@link Node#children()} and
 * {@link Node#mapChildren(UnaryOperator)}, so they work uniformly for every
 * node kind and keep untouched subtrees identical.
 */
public final class Nodes {

    private Nodes() {} // Utility class

    /**
     * Converts a value produced by the query-building layer into a node.
     *
     * <ul>
     *   <li>{@code null} becomes a NULL {@link LiteralNode}</li>
     *   <li>a {@link Node} is returned as is</li>
     *   <li>a {@link NodeGenerator} is replaced by its delegate</li>
     *   <li>a {@link List} or a record becomes a {@link ProductNode} of its
     *       elements or components, each narrowed in turn</li>
     * </ul>
     *
     * @param value the value to narrow
     * @return the node
     * @throws NodeNarrowingException if the value is of any other type
     */
    public static Node of(Object value) {
        if (value == null) {
            return LiteralNode.ofNull();
        }
        if (value instanceof Node) {
            return (Node) value;
        }
        if (value instanceof NodeGenerator) {
            return Objects.requireNonNull(((NodeGenerator) value).delegate(), "delegate must not be null");
        }
        if (value instanceof List) {
            List<Node> elements = new ArrayList<>();
            for (Object element : (List<?>) value) {
                elements.add(of(element));
            }
            return new ProductNode(elements);
        }
        if (value.getClass().isRecord()) {
            return new ProductNode(recordComponents(value));
        }
        throw new NodeNarrowingException(value);
    }

    private static List<Node> recordComponents(Object record) {
        List<Node> elements = new ArrayList<>();
        for (RecordComponent component : record.getClass().getRecordComponents()) {
            try {
                elements.add(of(component.getAccessor().invoke(record)));
            } catch (IllegalAccessException | InvocationTargetException e) {
                throw new NodeNarrowingException(record, e);
            }
        }
        return elements;
    }

    /**
     * Follows delegates until a node delegates to itself.
     *
     * @param node the node to resolve
     * @return the node that should be used in place of {@code node}
     */
    public static Node resolve(Node node) {
        Node current = node;
        Node next = current.delegate();
        while (next != current) {
            current = next;
            next = current.delegate();
        }
        return current;
    }

    /**
     * Rewrites a tree bottom-up: children are transformed before their parent.
     *
     * @param node the root of the tree
     * @param f the transformation, applied once to every node
     * @return the rewritten tree, or {@code node} itself if nothing changed
     */
    public static Node transformUp(Node node, UnaryOperator<Node> f) {
        Node withChildren = node.mapChildren(child -> transformUp(child, f));
        return f.apply(withChildren);
    }

    /**
     * Collects all nodes that match a predicate, in pre-order.
     *
     * @param node the root of the tree
     * @param predicate the filter
     * @return the matching nodes
     */
    public static List<Node> collect(Node node, Predicate<? super Node> predicate) {
        List<Node> result = new ArrayList<>();
        foreach(node, n -> {
            if (predicate.test(n)) {
                result.add(n);
            }
        });
        return result;
    }

    /**
     * Visits all nodes in pre-order.
     *
     * @param node the root of the tree
     * @param action the action to run on each node
     */
    public static void foreach(Node node, Consumer<? super Node> action) {
        action.accept(node);
        for (Node child : node.children()) {
            foreach(child, action);
        }
    }

    /**
     * Counts the distinct node instances in a tree. Shared subtrees are
     * counted once.
     *
     * @param node the root of the tree
     * @return the number of distinct instances
     */
    public static int countInstances(Node node) {
        Map<Node, Boolean> seen = new IdentityHashMap<>();
        foreach(node, n -> seen.put(n, Boolean.TRUE));
        return seen.size();
    }
}
