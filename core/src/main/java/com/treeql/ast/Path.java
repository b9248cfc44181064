package com.treeql.ast;

import com.treeql.symbol.Symbol;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Canonical form of a chain of field selections rooted at a {@link Ref}.
 *
 * <p>A path is a list of symbols with the outermost field first and the root
 * reference last. {@code Ref(s)} is the path {@code [s]}, and
 * {@code Select(p, f)} is {@code f} followed by the path of {@code p}. For
 * example {@code u.address.city} is {@code [city, address, u]}.
 */
public final class Path {

    private Path() {} // Utility class

    /**
     * Builds the nested selection for a path. The last symbol becomes the
     * innermost {@link Ref}.
     *
     * @param symbols the path, outermost field first, not empty
     * @return a {@code Ref} or a chain of {@code Select} nodes ending in a {@code Ref}
     * @throws IllegalArgumentException if {@code symbols} is empty
     */
    public static Node construct(List<? extends Symbol> symbols) {
        Objects.requireNonNull(symbols, "symbols must not be null");
        if (symbols.isEmpty()) {
            throw new IllegalArgumentException("path must contain at least one symbol");
        }
        Node node = new Ref(symbols.get(symbols.size() - 1));
        for (int i = symbols.size() - 2; i >= 0; i--) {
            node = new Select(node, symbols.get(i));
        }
        return node;
    }

    /**
     * Builds the nested selection for a path given root first, as it is
     * usually written.
     *
     * @param root the referenced symbol
     * @param fields the selected fields, innermost first
     * @return the path node
     */
    public static Node of(Symbol root, Symbol... fields) {
        List<Symbol> symbols = new ArrayList<>(fields.length + 1);
        symbols.add(root);
        Collections.addAll(symbols, fields);
        Collections.reverse(symbols);
        return construct(symbols);
    }

    /**
     * Recognizes a path.
     *
     * @param node the node to inspect
     * @return the path, outermost field first, or empty if {@code node} is not
     *         a chain of {@code Select} nodes ending in a {@code Ref}
     */
    public static Optional<List<Symbol>> deconstruct(Node node) {
        List<Symbol> symbols = new ArrayList<>();
        Node current = node;
        while (current instanceof Select) {
            Select select = (Select) current;
            symbols.add(select.field());
            current = select.in();
        }
        if (!(current instanceof Ref)) {
            return Optional.empty();
        }
        symbols.add(((Ref) current).symbol());
        return Optional.of(Collections.unmodifiableList(symbols));
    }

    /**
     * Renders a path root first, e.g. {@code Path @3.address.city}.
     *
     * @param symbols the path, outermost field first
     * @return the rendering
     */
    public static String render(List<? extends Symbol> symbols) {
        StringBuilder sb = new StringBuilder("Path ");
        for (int i = symbols.size() - 1; i >= 0; i--) {
            sb.append(symbols.get(i));
            if (i > 0) {
                sb.append('.');
            }
        }
        return sb.toString();
    }
}
