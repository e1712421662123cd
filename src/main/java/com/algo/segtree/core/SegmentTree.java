package com.algo.segtree.core;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import com.algo.segtree.api.Monoid;
import com.algo.segtree.api.PointUpdater;
import com.algo.segtree.api.RangeAggregator;
import com.algo.segtree.util.RangeChecks;

import lombok.extern.log4j.Log4j2;

/**
 * Static segment tree: point update, range query.
 *
 * <p>
 * The tree is a flat array of {@code 2 * size} slots. Leaves live at
 * {@code [size, 2 * size)} in input order and internal slot {@code i} holds
 * {@code combine(tree[2i], tree[2i + 1])}. Slot 0 is unused.
 *
 * <p>
 * Queries walk two cursors bottom-up from the range boundaries and keep the
 * left and right partial results apart, so the fold stays in index order for
 * non-commutative monoids. Any size works; it does not need to be a power of
 * two.
 *
 * <p>
 * Complexity: construction O(n), {@link #query} and point {@link #update}
 * O(log n).
 *
 * @param <T> The aggregated value type.
 * @param <U> The point update type.
 */
@Log4j2
public final class SegmentTree<T, U> implements RangeAggregator<T, U> {
    private final int size;
    private final Monoid<T> monoid;
    private final PointUpdater<T, U> updater;

    // tree[size + i] is position i; tree[i] for 1 <= i < size aggregates its children.
    private final Object[] tree;

    /**
     * Creates a tree with every position set to the identity.
     */
    public SegmentTree(int size, Monoid<T> monoid, PointUpdater<T, U> updater) {
        if (size < 0) {
            throw new IllegalArgumentException("Negative size: " + size);
        }
        this.size = size;
        this.monoid = Objects.requireNonNull(monoid, "monoid");
        this.updater = Objects.requireNonNull(updater, "updater");
        this.tree = new Object[2 * size];
        Arrays.fill(tree, monoid.identity());
    }

    /**
     * Creates a tree over a copy of {@code values}, building internal slots
     * bottom-up.
     */
    public SegmentTree(List<? extends T> values, Monoid<T> monoid, PointUpdater<T, U> updater) {
        this.size = values.size();
        this.monoid = Objects.requireNonNull(monoid, "monoid");
        this.updater = Objects.requireNonNull(updater, "updater");
        this.tree = new Object[2 * size];
        for (int i = 0; i < size; i++) {
            tree[size + i] = values.get(i);
        }
        for (int i = size - 1; i > 0; i--) {
            tree[i] = monoid.combine(at(2 * i), at(2 * i + 1));
        }
        log.debug("Built segment tree over {} positions", size);
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public Monoid<T> monoid() {
        return monoid;
    }

    @Override
    public T get(int index) {
        RangeChecks.checkIndex(index, size);
        return at(size + index);
    }

    @Override
    public T query(int from, int to) {
        RangeChecks.checkRange(from, to, 0, size);
        T leftResult = monoid.identity();
        T rightResult = monoid.identity();
        int l = from + size;
        int r = to + size;
        while (l < r) {
            if ((l & 1) == 1) {
                leftResult = monoid.combine(leftResult, at(l++));
            }
            if ((r & 1) == 1) {
                rightResult = monoid.combine(at(--r), rightResult);
            }
            l >>= 1;
            r >>= 1;
        }
        return monoid.combine(leftResult, rightResult);
    }

    /**
     * Replaces position {@code index} with {@code apply(current, update)} and
     * recomputes its ancestors up to the root.
     */
    public void update(int index, U update) {
        RangeChecks.checkIndex(index, size);
        int pos = index + size;
        tree[pos] = updater.apply(at(pos), update);
        for (pos >>= 1; pos > 0; pos >>= 1) {
            tree[pos] = monoid.combine(at(2 * pos), at(2 * pos + 1));
        }
    }

    /**
     * Applies {@code update} to each position of {@code [from, to)} one by one.
     *
     * <p>
     * There is no deferred state here, so this costs O((to - from) log n). Use
     * {@link LazySegmentTree} when ranges are long.
     */
    @Override
    public void update(int from, int to, U update) {
        RangeChecks.checkRange(from, to, 0, size);
        for (int i = from; i < to; i++) {
            update(i, update);
        }
    }

    @SuppressWarnings("unchecked")
    private T at(int slot) {
        return (T) tree[slot];
    }
}
