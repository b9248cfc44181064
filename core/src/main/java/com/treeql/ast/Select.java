package com.treeql.ast;

import com.treeql.exception.NodeConstructionException;
import com.treeql.symbol.Symbol;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Selects a field from a value.
 *
 * <p>The target may not be a raw {@link TableNode}. A table has to be bound to
 * a generator (see {@link TableExpansion}) and its fields are then selected
 * from a {@link Ref} to that generator. A chain of selections rooted at a
 * {@code Ref} is a {@link Path}.
 */
public final class Select extends UnaryNode implements RefNode {

    private final Node in;
    private final Symbol field;

    /**
     * Creates a field selection.
     *
     * @param in the value to select from
     * @param field the selected field
     * @throws NodeConstructionException if {@code in} is a raw table
     */
    public Select(Node in, Symbol field) {
        this.in = Objects.requireNonNull(in, "in must not be null");
        this.field = Objects.requireNonNull(field, "field must not be null");
        if (in instanceof TableNode) {
            throw new NodeConstructionException(
                "Select(" + in + ", \"" + field + "\") found. This is typically caused by "
                    + "using a raw table directly in a query without introducing it through a generator",
                in);
        }
    }

    public Node in() {
        return in;
    }

    public Symbol field() {
        return field;
    }

    @Override
    public Node child() {
        return in;
    }

    @Override
    public List<String> childNames() {
        return List.of("in");
    }

    @Override
    protected Node rebuild(Node child) {
        return new Select(child, field);
    }

    @Override
    public Symbol reference() {
        return field;
    }

    @Override
    public Node rebuildWithReference(Symbol symbol) {
        return new Select(in, symbol);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Select)) return false;
        Select that = (Select) obj;
        return field.equals(that.field) && in.equals(that.in);
    }

    @Override
    public int hashCode() {
        return Objects.hash("Select", in, field);
    }

    @Override
    public String toString() {
        Optional<List<Symbol>> path = Path.deconstruct(this);
        return path.map(Path::render).orElse("Select " + field);
    }
}
