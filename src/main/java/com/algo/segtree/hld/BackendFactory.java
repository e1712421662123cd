package com.algo.segtree.hld;

import java.util.List;

import com.algo.segtree.api.RangeAggregator;

/**
 * Creates the range structure a {@link HeavyLightDecomposition} stores node
 * values in.
 *
 * <p>
 * Examples:
 * <ul>
 * <li>{@code values -> new SegmentTree<>(values, monoid, updater)}</li>
 * <li>{@code values -> new LazySegmentTree<>(values, monoid, lazyUpdater)}</li>
 * </ul>
 *
 * The returned structure is owned by the decomposition; callers must not keep
 * a reference to it.
 *
 * @param <T> The aggregated value type.
 * @param <U> The update type.
 */
@FunctionalInterface
public interface BackendFactory<T, U> {
    /**
     * @param initialValues Node values in preorder: element {@code i} belongs to
     *                      the node with preorder number {@code i + 1}.
     * @return A new structure over exactly these values.
     */
    RangeAggregator<T, U> create(List<T> initialValues);
}
