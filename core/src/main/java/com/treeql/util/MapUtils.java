package com.treeql.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Change-detecting mapping over lists.
 *
 * <p>This is the one traversal primitive behind every node rewrite in the
 * library. A mapping that returns each input element unchanged (the same
 * instance) is reported as "no change", so callers can keep the original
 * container instead of allocating a copy. Optimizer passes that are re-run to
 * a fixpoint therefore pay nothing for subtrees they do not touch.
 */
public final class MapUtils {

    private MapUtils() {} // Utility class

    /**
     * Applies {@code f} to every element of {@code list}.
     *
     * <p>Change detection compares by reference: an element counts as changed
     * iff {@code f} returned a different instance, even one that is equal to the
     * input. The function is applied to every element in order, also after the
     * first change was seen.
     *
     * @param list the input elements
     * @param f the per-element transformation, must not return null
     * @param <T> the element type
     * @return the mapped elements as an unmodifiable list, or empty if no element changed
     */
    public static <T> Optional<List<T>> mapOrNone(List<? extends T> list, Function<? super T, ? extends T> f) {
        Objects.requireNonNull(list, "list must not be null");
        Objects.requireNonNull(f, "f must not be null");

        List<T> mapped = new ArrayList<>(list.size());
        boolean changed = false;
        for (T element : list) {
            T result = Objects.requireNonNull(f.apply(element), "mapping function returned null");
            if (result != element) {
                changed = true;
            }
            mapped.add(result);
        }
        return changed ? Optional.of(Collections.unmodifiableList(mapped)) : Optional.empty();
    }
}
