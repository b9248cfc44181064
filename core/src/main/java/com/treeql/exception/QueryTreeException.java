package com.treeql.exception;

import com.treeql.ast.Node;

/**
 * Base exception for failures while building or manipulating a query tree.
 *
 * <p>Errors are reported synchronously at the point of construction or
 * rewriting. Tree construction is deterministic, so callers should not retry.
 * The offending node, if there is one, is kept for diagnostics.
 *
 * @see NodeConstructionException
 * @see NodeNarrowingException
 */
public class QueryTreeException extends RuntimeException {

    private final transient Node failedNode;

    /**
     * Creates a query tree exception.
     *
     * @param message the error message
     * @param node the node involved in the failure (may be null)
     */
    public QueryTreeException(String message, Node node) {
        super(message + " (node type: " + (node != null ? node.getClass().getSimpleName() : "null") + ")");
        this.failedNode = node;
    }

    /**
     * Creates a query tree exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     * @param node the node involved in the failure (may be null)
     */
    public QueryTreeException(String message, Throwable cause, Node node) {
        super(message + " (node type: " + (node != null ? node.getClass().getSimpleName() : "null") + ")", cause);
        this.failedNode = node;
    }

    /**
     * Creates an exception that is not tied to a node.
     *
     * @param message the error message
     * @param cause the underlying cause (may be null)
     */
    protected QueryTreeException(String message, Throwable cause) {
        super(message, cause);
        this.failedNode = null;
    }

    /**
     * Returns the node involved in the failure.
     *
     * @return the node, or null if not available
     */
    public Node getFailedNode() {
        return failedNode;
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Query Tree Error\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (failedNode != null) {
            sb.append("Node Type: ").append(failedNode.getClass().getName()).append("\n");
            sb.append("Node: ").append(failedNode).append("\n");
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}
