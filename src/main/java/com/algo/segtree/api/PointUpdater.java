package com.algo.segtree.api;

/**
 * Applies an update to the value of a single position.
 *
 * <p>
 * Examples:
 * <ul>
 * <li>{@code (value, delta) -> value + delta}</li>
 * <li>{@code (value, replacement) -> replacement}</li>
 * </ul>
 *
 * @param <T> The stored value type.
 * @param <U> The update type.
 */
@FunctionalInterface
public interface PointUpdater<T, U> {
    /**
     * @param value  The current value at the position.
     * @param update The update to apply.
     * @return The new value.
     */
    T apply(T value, U update);
}
