package com.treeql.exception;

import com.treeql.ast.Node;

/**
 * Thrown when a node is constructed with a structurally invalid shape.
 *
 * <p>Common causes:
 * <ul>
 *   <li>Selecting a field directly from a raw table instead of from a
 *       generator bound through a table expansion</li>
 *   <li>A conditional expression whose clauses are not {@code IfThen} nodes</li>
 * </ul>
 */
public class NodeConstructionException extends QueryTreeException {

    /**
     * @param message the error message
     * @param node the offending child node (may be null)
     */
    public NodeConstructionException(String message, Node node) {
        super(message, node);
    }
}
