package com.treeql.ast;

import com.treeql.symbol.Symbol;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A set of named definitions that are in scope for {@code in} and for each
 * other, independent of the order in which they are listed.
 *
 * <p>Circular dependencies between definitions are not allowed, but they are
 * not detected here: the node neither orders nor evaluates its definitions.
 * The children are the definitions followed by the body.
 */
public final class LetDynamic extends Node implements DefNode {

    private final List<Generator> defs;
    private final Node in;

    public LetDynamic(List<Generator> defs, Node in) {
        this.defs = List.copyOf(Objects.requireNonNull(defs, "defs must not be null"));
        this.in = Objects.requireNonNull(in, "in must not be null");
    }

    public List<Generator> defs() {
        return defs;
    }

    public Node in() {
        return in;
    }

    @Override
    public List<Node> children() {
        List<Node> children = new ArrayList<>(defs.size() + 1);
        for (Generator def : defs) {
            children.add(def.source());
        }
        children.add(in);
        return List.copyOf(children);
    }

    @Override
    public List<String> childNames() {
        List<String> names = new ArrayList<>(defs.size() + 1);
        for (Generator def : defs) {
            names.add("let " + def.symbol());
        }
        names.add("in");
        return List.copyOf(names);
    }

    @Override
    protected Node nodeRebuild(List<Node> newChildren) {
        List<Generator> newDefs = new ArrayList<>(defs.size());
        for (int i = 0; i < defs.size(); i++) {
            newDefs.add(new Generator(defs.get(i).symbol(), newChildren.get(i)));
        }
        return new LetDynamic(newDefs, newChildren.get(defs.size()));
    }

    @Override
    public List<Generator> generators() {
        return defs;
    }

    @Override
    public Node rebuildWithGenerators(List<Symbol> symbols) {
        DefNode.checkGeneratorCount(this, symbols);
        List<Generator> newDefs = new ArrayList<>(defs.size());
        for (int i = 0; i < defs.size(); i++) {
            newDefs.add(new Generator(symbols.get(i), defs.get(i).source()));
        }
        return new LetDynamic(newDefs, in);
    }

    /**
     * Every definition is visible in every definition and in the body.
     */
    @Override
    public List<Symbol> symbolsInScope(int childIndex) {
        List<Symbol> symbols = new ArrayList<>(defs.size());
        for (Generator def : defs) {
            symbols.add(def.symbol());
        }
        return symbols;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof LetDynamic)) return false;
        LetDynamic that = (LetDynamic) obj;
        return defs.equals(that.defs) && in.equals(that.in);
    }

    @Override
    public int hashCode() {
        return Objects.hash("LetDynamic", defs, in);
    }

    @Override
    public String toString() {
        return "LetDynamic";
    }
}
