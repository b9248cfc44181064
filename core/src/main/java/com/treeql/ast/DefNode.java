package com.treeql.ast;

import com.treeql.symbol.Symbol;
import com.treeql.util.MapUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Capability of nodes that introduce symbol bindings.
 *
 * <p>A binding node declares its generators, each a symbol paired with the
 * child it ranges over, and can be rebuilt with a replacement list of symbols
 * (alpha-renaming) while all children and other attributes stay the same.
 *
 * <p>Unless a kind says otherwise, the i-th generator ranges over the i-th
 * child and is visible in every later child. A {@link Filter} predicate
 * therefore sees the filter's generator. Kinds whose sources are independent
 * narrow this: a {@link Join} condition sees both join generators but neither
 * side sees the other, and the sides of a {@link Union} see nothing.
 * {@link LetDynamic} makes all of its definitions visible everywhere.
 */
public sealed interface DefNode
    permits FilteredQuery, StructNode, GroupBy, Join, Union, Bind,
            TableExpansion, TableRefExpansion, LetDynamic {

    /**
     * Returns the bindings introduced by this node, in declaration order.
     *
     * @return the generators
     */
    List<Generator> generators();

    /**
     * Rebuilds this node with new generator symbols.
     *
     * @param symbols the replacement symbols, one per generator and in the same order
     * @return the rebuilt node
     * @throws AssertionError if the number of symbols does not match
     */
    Node rebuildWithGenerators(List<Symbol> symbols);

    /**
     * Returns the children of this node.
     *
     * @return the children
     * @see Node#children()
     */
    List<Node> children();

    /**
     * Applies a function to all generator symbols and rebuilds this node with
     * the results.
     *
     * @param f the renaming function
     * @return this node if no symbol changed, otherwise a rebuilt node
     */
    default Node mapGenerators(UnaryOperator<Symbol> f) {
        List<Symbol> current = generators().stream()
            .map(Generator::symbol)
            .collect(Collectors.toList());
        return MapUtils.mapOrNone(current, f)
            .map(this::rebuildWithGenerators)
            .orElse((Node) this);
    }

    /**
     * Returns the generator symbols visible inside the given child.
     *
     * @param childIndex the position of the child in {@link #children()}
     * @return the symbols bound for that child, possibly empty
     */
    default List<Symbol> symbolsInScope(int childIndex) {
        List<Generator> generators = generators();
        List<Symbol> visible = new ArrayList<>();
        for (int i = 0; i < generators.size() && i < childIndex; i++) {
            visible.add(generators.get(i).symbol());
        }
        return visible;
    }

    /**
     * Asserts that a replacement symbol list matches the generator count.
     *
     * @param node the node being rebuilt
     * @param symbols the replacement symbols
     */
    static void checkGeneratorCount(DefNode node, List<Symbol> symbols) {
        int expected = node.generators().size();
        if (symbols.size() != expected) {
            throw new AssertionError(String.format(
                "%s expects %d generator symbols, got %d",
                node.getClass().getSimpleName(), expected, symbols.size()));
        }
    }
}
