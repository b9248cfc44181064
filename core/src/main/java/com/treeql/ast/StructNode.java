package com.treeql.ast;

import com.treeql.symbol.Symbol;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A record whose fields are each named by a symbol.
 *
 * <p>{@link #generators()} is empty: the fields are not bindings that any child
 * of this node can refer to, so scoping passes have nothing to track here.
 * Field symbols are renamed through {@link #withFieldSymbols(List)}.
 */
public final class StructNode extends Node implements DefNode {

    private final List<Field> fields;

    public StructNode(List<Field> fields) {
        this.fields = List.copyOf(Objects.requireNonNull(fields, "fields must not be null"));
    }

    /**
     * Returns the fields of this record.
     *
     * @return the named fields, in order
     */
    public List<Field> fields() {
        return fields;
    }

    /**
     * Returns the symbols naming the fields, in order.
     *
     * @return the field symbols
     */
    public List<Symbol> fieldSymbols() {
        return fields.stream().map(Field::symbol).collect(Collectors.toUnmodifiableList());
    }

    @Override
    public List<Node> children() {
        return fields.stream().map(Field::value).collect(Collectors.toUnmodifiableList());
    }

    @Override
    public List<String> childNames() {
        return fields.stream().map(f -> f.symbol().toString()).collect(Collectors.toUnmodifiableList());
    }

    @Override
    protected Node nodeRebuild(List<Node> newChildren) {
        List<Field> rebuilt = new ArrayList<>(fields.size());
        for (int i = 0; i < fields.size(); i++) {
            rebuilt.add(new Field(fields.get(i).symbol(), newChildren.get(i)));
        }
        return new StructNode(rebuilt);
    }

    @Override
    public List<Generator> generators() {
        return List.of();
    }

    /**
     * Records declare no generators, so the only valid argument is the empty
     * list. Use {@link #withFieldSymbols(List)} to rename fields.
     *
     * @param symbols the replacement generator symbols, must be empty
     * @return this record
     * @throws AssertionError if {@code symbols} is not empty
     */
    @Override
    public Node rebuildWithGenerators(List<Symbol> symbols) {
        DefNode.checkGeneratorCount(this, symbols);
        return this;
    }

    /**
     * Renames the fields of this record.
     *
     * @param symbols the new field symbols, one per field
     * @return this record if no symbol changed, otherwise a rebuilt record
     * @throws AssertionError if the number of symbols does not match
     */
    public StructNode withFieldSymbols(List<? extends Symbol> symbols) {
        if (symbols.size() != fields.size()) {
            throw new AssertionError(String.format(
                "StructNode expects %d field symbols, got %d", fields.size(), symbols.size()));
        }
        List<Field> rebuilt = new ArrayList<>(fields.size());
        boolean changed = false;
        for (int i = 0; i < fields.size(); i++) {
            Field field = fields.get(i);
            Symbol symbol = symbols.get(i);
            changed |= symbol != field.symbol();
            rebuilt.add(symbol == field.symbol() ? field : new Field(symbol, field.value()));
        }
        return changed ? new StructNode(rebuilt) : this;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof StructNode)) return false;
        return fields.equals(((StructNode) obj).fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash("StructNode", fields);
    }

    @Override
    public String toString() {
        return "StructNode";
    }

    /**
     * A named field of a {@link StructNode}.
     */
    public record Field(Symbol symbol, Node value) {

        public Field {
            Objects.requireNonNull(symbol, "symbol must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }
}
