package com.treeql.ast;

import com.treeql.exception.NodeConstructionException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A multi-way conditional: the result of the first {@link IfThen} clause whose
 * condition holds, in list order, or {@code elseClause} if none does.
 *
 * <p>The children are the else clause followed by the clauses.
 */
public final class ConditionalExpr extends Node {

    private final List<IfThen> clauses;
    private final Node elseClause;

    /**
     * Creates a conditional expression.
     *
     * @param clauses the if-then clauses, possibly empty
     * @param elseClause the result when no clause matches
     */
    public ConditionalExpr(List<IfThen> clauses, Node elseClause) {
        this.clauses = List.copyOf(Objects.requireNonNull(clauses, "clauses must not be null"));
        this.elseClause = Objects.requireNonNull(elseClause, "elseClause must not be null");
    }

    public List<IfThen> clauses() {
        return clauses;
    }

    public Node elseClause() {
        return elseClause;
    }

    @Override
    public List<Node> children() {
        List<Node> children = new ArrayList<>(clauses.size() + 1);
        children.add(elseClause);
        children.addAll(clauses);
        return List.copyOf(children);
    }

    @Override
    public List<String> childNames() {
        List<String> names = new ArrayList<>(clauses.size() + 1);
        names.add("else");
        for (int i = 0; i < clauses.size(); i++) {
            names.add("if" + i);
        }
        return List.copyOf(names);
    }

    @Override
    protected Node nodeRebuild(List<Node> newChildren) {
        List<IfThen> newClauses = new ArrayList<>(clauses.size());
        for (Node clause : newChildren.subList(1, newChildren.size())) {
            if (!(clause instanceof IfThen)) {
                throw new NodeConstructionException("ConditionalExpr clauses must be IfThen nodes", clause);
            }
            newClauses.add((IfThen) clause);
        }
        return new ConditionalExpr(newClauses, newChildren.get(0));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ConditionalExpr)) return false;
        ConditionalExpr that = (ConditionalExpr) obj;
        return clauses.equals(that.clauses) && elseClause.equals(that.elseClause);
    }

    @Override
    public int hashCode() {
        return Objects.hash("ConditionalExpr", clauses, elseClause);
    }

    @Override
    public String toString() {
        return "ConditionalExpr";
    }
}
