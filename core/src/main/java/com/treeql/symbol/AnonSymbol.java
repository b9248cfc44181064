package com.treeql.symbol;

import java.util.concurrent.atomic.AtomicLong;

/**
 * A freshly generated symbol that is distinct from every other symbol.
 *
 * <p>Ids are drawn from a process-wide counter that starts at 1 and is never
 * reset, so two anonymous symbols never share a name. Allocation is a single
 * atomic increment and needs no further coordination between threads.
 * Equality is reference identity.
 */
public final class AnonSymbol implements Symbol {

    private static final AtomicLong COUNTER = new AtomicLong();

    private final long id;

    /**
     * Allocates a new anonymous symbol.
     */
    public AnonSymbol() {
        this.id = COUNTER.incrementAndGet();
    }

    /**
     * Returns the numeric id of this symbol.
     *
     * @return the id, unique within this process
     */
    public long id() {
        return id;
    }

    @Override
    public String name() {
        return "@" + id;
    }

    @Override
    public String toString() {
        return name();
    }
}
