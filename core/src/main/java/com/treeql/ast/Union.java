package com.treeql.ast;

import com.treeql.symbol.AnonSymbol;
import com.treeql.symbol.Symbol;
import java.util.List;
import java.util.Objects;

/**
 * Set union of two collections with the same row type.
 *
 * <p>With {@code all} set, duplicates are kept (UNION ALL). Otherwise they are
 * eliminated (UNION).
 */
public final class Union extends BinaryNode implements DefNode {

    private final Node left;
    private final Node right;
    private final boolean all;
    private final Symbol leftGen;
    private final Symbol rightGen;

    /**
     * Creates a union node.
     *
     * @param left the left relation
     * @param right the right relation
     * @param all true to keep duplicates, false to remove them
     * @param leftGen the symbol naming a row of the left relation
     * @param rightGen the symbol naming a row of the right relation
     */
    public Union(Node left, Node right, boolean all, Symbol leftGen, Symbol rightGen) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
        this.all = all;
        this.leftGen = Objects.requireNonNull(leftGen, "leftGen must not be null");
        this.rightGen = Objects.requireNonNull(rightGen, "rightGen must not be null");
    }

    /**
     * Creates a union node with fresh anonymous generators.
     *
     * @param left the left relation
     * @param right the right relation
     * @param all true to keep duplicates, false to remove them
     */
    public Union(Node left, Node right, boolean all) {
        this(left, right, all, new AnonSymbol(), new AnonSymbol());
    }

    @Override
    public Node left() {
        return left;
    }

    @Override
    public Node right() {
        return right;
    }

    public boolean all() {
        return all;
    }

    public Symbol leftGen() {
        return leftGen;
    }

    public Symbol rightGen() {
        return rightGen;
    }

    @Override
    public List<String> childNames() {
        return List.of("left " + leftGen, "right " + rightGen);
    }

    @Override
    protected Node rebuild(Node newLeft, Node newRight) {
        return new Union(newLeft, newRight, all, leftGen, rightGen);
    }

    @Override
    public List<Generator> generators() {
        return List.of(new Generator(leftGen, left), new Generator(rightGen, right));
    }

    @Override
    public Node rebuildWithGenerators(List<Symbol> symbols) {
        DefNode.checkGeneratorCount(this, symbols);
        return new Union(left, right, all, symbols.get(0), symbols.get(1));
    }

    /**
     * Neither side sees a generator. They only name the rows of the result.
     */
    @Override
    public List<Symbol> symbolsInScope(int childIndex) {
        return List.of();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Union)) return false;
        Union that = (Union) obj;
        return all == that.all &&
               leftGen.equals(that.leftGen) &&
               rightGen.equals(that.rightGen) &&
               left.equals(that.left) &&
               right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash("Union", left, right, all, leftGen, rightGen);
    }

    @Override
    public String toString() {
        return all ? "Union all" : "Union";
    }
}
