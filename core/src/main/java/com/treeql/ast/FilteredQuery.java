package com.treeql.ast;

import com.treeql.symbol.Symbol;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Common view of the collection operators that keep their source's row type:
 * {@link Filter}, {@link SortBy}, {@link Take} and {@link Drop}.
 *
 * <p>Each of them binds one generator over its source, which is always the
 * first child.
 */
public sealed interface FilteredQuery extends DefNode
    permits Filter, SortBy, Take, Drop {

    /**
     * Returns the symbol naming a row of the source.
     *
     * @return the generator symbol
     */
    Symbol generator();

    /**
     * Returns the source collection.
     *
     * @return the source node
     */
    Node from();

    @Override
    default List<Generator> generators() {
        return List.of(new Generator(generator(), from()));
    }

    /**
     * Maps only the source child, leaving the others untouched.
     *
     * @param f the mapping function
     * @return this node if the source was mapped to itself, otherwise a rebuilt node
     */
    default Node mapFrom(UnaryOperator<Node> f) {
        return mapIndexed(f, true);
    }

    /**
     * Maps every child except the source.
     *
     * @param f the mapping function
     * @return this node if nothing changed, otherwise a rebuilt node
     */
    default Node mapOthers(UnaryOperator<Node> f) {
        return mapIndexed(f, false);
    }

    private Node mapIndexed(UnaryOperator<Node> f, boolean sourceOnly) {
        Node self = (Node) this;
        List<Node> children = children();
        Node[] mapped = children.toArray(new Node[0]);
        boolean changed = false;
        for (int i = 0; i < mapped.length; i++) {
            if ((i == 0) == sourceOnly) {
                mapped[i] = f.apply(children.get(i));
                changed |= mapped[i] != children.get(i);
            }
        }
        return changed ? self.rebuild(List.of(mapped)) : self;
    }
}
