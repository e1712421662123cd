package com.algo.segtree.api;

/**
 * Applies range updates to aggregates and merges pending updates.
 *
 * <p>
 * A lazy structure stores an update at the highest node that the updated range
 * fully covers, and only pushes it to the children when a later call needs to
 * look inside that node. For this to be correct an implementation must obey:
 * <ul>
 * <li>{@code apply(apply(x, a, n), b, n) == apply(x, compose(a, b, n), n)}</li>
 * <li>{@code apply(combine(x, y), u, n + m) == combine(apply(x, u, n), apply(y, u, m))}
 * where {@code x} covers {@code n} positions and {@code y} covers {@code m}</li>
 * </ul>
 *
 * <p>
 * The {@code length} argument is the number of positions the aggregate covers.
 * Updates such as "add v to every element" under a sum need it; updates such
 * as "add v" under a min ignore it.
 *
 * @param <T> The aggregated value type.
 * @param <U> The update type.
 */
public interface LazyUpdater<T, U> {

    /**
     * Applies {@code update} to an aggregate covering {@code length} positions.
     */
    T apply(T value, U update, long length);

    /**
     * Merges a newly arriving update into one that is still pending on the same
     * node.
     *
     * @param pending  The update already stored at the node (older).
     * @param incoming The update being added (newer).
     * @param length   Number of positions the node covers.
     * @return An update equivalent to {@code pending} followed by {@code incoming}.
     */
    U compose(U pending, U incoming, long length);
}
