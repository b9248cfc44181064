package com.treeql.ast;

import com.treeql.symbol.Symbol;
import java.util.List;
import java.util.Objects;

/**
 * Joins two collections.
 *
 * <p>{@code leftGen} and {@code rightGen} name a row of each side and are both
 * visible in the join condition {@code on}. The children are
 * {@code [left, right, on]}. The join kind is an attribute, not a child.
 */
public final class Join extends Node implements DefNode {

    private final Symbol leftGen;
    private final Symbol rightGen;
    private final Node left;
    private final Node right;
    private final JoinType joinType;
    private final Node on;

    /**
     * Creates a join node.
     *
     * @param leftGen the symbol naming a row of the left side
     * @param rightGen the symbol naming a row of the right side
     * @param left the left relation
     * @param right the right relation
     * @param joinType the join type
     * @param on the join condition
     */
    public Join(Symbol leftGen, Symbol rightGen, Node left, Node right, JoinType joinType, Node on) {
        this.leftGen = Objects.requireNonNull(leftGen, "leftGen must not be null");
        this.rightGen = Objects.requireNonNull(rightGen, "rightGen must not be null");
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
        this.joinType = Objects.requireNonNull(joinType, "joinType must not be null");
        this.on = Objects.requireNonNull(on, "on must not be null");
    }

    public Symbol leftGen() {
        return leftGen;
    }

    public Symbol rightGen() {
        return rightGen;
    }

    public Node left() {
        return left;
    }

    public Node right() {
        return right;
    }

    public JoinType joinType() {
        return joinType;
    }

    public Node on() {
        return on;
    }

    @Override
    public List<Node> children() {
        return List.of(left, right, on);
    }

    @Override
    public List<String> childNames() {
        return List.of("left " + leftGen, "right " + rightGen, "on");
    }

    @Override
    protected Node nodeRebuild(List<Node> newChildren) {
        return new Join(leftGen, rightGen, newChildren.get(0), newChildren.get(1), joinType, newChildren.get(2));
    }

    @Override
    public List<Generator> generators() {
        return List.of(new Generator(leftGen, left), new Generator(rightGen, right));
    }

    @Override
    public Node rebuildWithGenerators(List<Symbol> symbols) {
        DefNode.checkGeneratorCount(this, symbols);
        return new Join(symbols.get(0), symbols.get(1), left, right, joinType, on);
    }

    /**
     * Only the join condition sees the generators. Each side is evaluated
     * independently of the other.
     */
    @Override
    public List<Symbol> symbolsInScope(int childIndex) {
        return childIndex == 2 ? List.of(leftGen, rightGen) : List.of();
    }

    /**
     * Returns a join with some attributes replaced. The condition is kept.
     *
     * @return this instance if every argument is the current value, otherwise a new join
     */
    public Join copyJoin(Symbol newLeftGen, Symbol newRightGen, Node newLeft, Node newRight, JoinType newJoinType) {
        if (newLeftGen == leftGen && newRightGen == rightGen && newLeft == left
                && newRight == right && newJoinType == joinType) {
            return this;
        }
        return new Join(newLeftGen, newRightGen, newLeft, newRight, newJoinType, on);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Join)) return false;
        Join that = (Join) obj;
        return joinType == that.joinType &&
               leftGen.equals(that.leftGen) &&
               rightGen.equals(that.rightGen) &&
               left.equals(that.left) &&
               right.equals(that.right) &&
               on.equals(that.on);
    }

    @Override
    public int hashCode() {
        return Objects.hash("Join", leftGen, rightGen, left, right, joinType, on);
    }

    @Override
    public String toString() {
        return "Join " + joinType.sqlName();
    }
}
