package com.treeql.exception;

/**
 * Thrown when an arbitrary value cannot be converted into a tree node.
 *
 * <p>This means the query-building layer passed a value that is neither a node,
 * a node generator nor a composite such as a list or a record.
 */
public class NodeNarrowingException extends QueryTreeException {

    private final transient Object value;

    /**
     * @param value the value that could not be narrowed (may be null)
     */
    public NodeNarrowingException(Object value) {
        super("Cannot narrow " + value + " of type "
            + (value != null ? value.getClass().getSimpleName() : "null") + " to a Node", (Throwable) null);
        this.value = value;
    }

    /**
     * @param value the value that could not be narrowed
     * @param cause the failure that occurred while decomposing the value
     */
    public NodeNarrowingException(Object value, Throwable cause) {
        super("Cannot narrow " + value + " of type "
            + (value != null ? value.getClass().getSimpleName() : "null") + " to a Node", cause);
        this.value = value;
    }

    /**
     * Returns the value that could not be narrowed.
     *
     * @return the rejected value
     */
    public Object getValue() {
        return value;
    }
}
