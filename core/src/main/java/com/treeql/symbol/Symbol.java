package com.treeql.symbol;

/**
 * An identifier used to bind and reference values in a query tree.
 *
 * <p>Symbols appear in two roles:
 * <ul>
 *   <li>As generators, introduced by binding nodes such as {@code Filter} or
 *       {@code Join} to name the rows they range over</li>
 *   <li>As references, held by {@code Ref}, {@code Select} and {@code Apply}
 *       nodes to point at a generator, a field or a function</li>
 * </ul>
 *
 * <p>All variants are immutable and safe to share between threads. Equality is
 * defined per variant: anonymous symbols are only equal to themselves, named
 * variants compare by name.
 */
public sealed interface Symbol
    permits AnonSymbol, TableSymbol, FieldSymbol, ElementSymbol, IntrinsicSymbol {

    /**
     * Returns the display name of this symbol.
     *
     * @return the name, never null
     */
    String name();
}
