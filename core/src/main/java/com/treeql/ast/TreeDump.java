package com.treeql.ast;

import java.util.List;

/**
 * Renders a tree as indented text, one node per line.
 *
 * <p>Every line holds the name the parent gives to the child (see
 * {@link Node#childNames()}) followed by the node's own description:
 * <pre>
 * Filter
 *   from @1: Table users
 *   where: Apply &gt;
 *     0: Path @1.age
 *     1: LiteralNode 21
 * </pre>
 */
public final class TreeDump {

    private static final String INDENT = "  ";

    private TreeDump() {} // Utility class

    /**
     * Renders a tree.
     *
     * @param node the root of the tree
     * @return the multi-line rendering, without a trailing line break
     */
    public static String dump(Node node) {
        StringBuilder sb = new StringBuilder();
        dump(node, null, "", sb);
        return sb.toString();
    }

    private static void dump(Node node, String name, String indent, StringBuilder sb) {
        if (sb.length() > 0) {
            sb.append('\n');
        }
        sb.append(indent);
        if (name != null) {
            sb.append(name).append(": ");
        }
        sb.append(node);

        List<Node> children = node.children();
        List<String> names = node.childNames();
        for (int i = 0; i < children.size(); i++) {
            String childName = i < names.size() ? names.get(i) : Integer.toString(i);
            dump(children.get(i), childName, indent + INDENT, sb);
        }
    }
}
