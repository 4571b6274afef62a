package com.caret.analyze.common;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Collection helpers shared by the lookup operations.
 */
public final class Items {

    private Items() {
        // utility class
    }

    /**
     * Concatenates nested iterables into a single list, preserving iteration order.
     */
    public static <T> List<T> flatten(Iterable<? extends Iterable<? extends T>> nested) {
        Objects.requireNonNull(nested, "nested must not be null");
        List<T> result = new ArrayList<>();
        for (Iterable<? extends T> inner : nested) {
            for (T item : inner) {
                result.add(item);
            }
        }
        return result;
    }

    /**
     * Returns the items matching the condition, in iteration order.
     * A {@code null} source is treated as empty.
     */
    public static <T> List<T> filterItems(Predicate<? super T> condition, Iterable<? extends T> items) {
        Objects.requireNonNull(condition, "condition must not be null");
        List<T> filtered = new ArrayList<>();
        if (items == null) {
            return filtered;
        }
        for (T item : items) {
            if (condition.test(item)) {
                filtered.add(item);
            }
        }
        return filtered;
    }
}
