package com.algo.segtree.core;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.algo.segtree.api.LazyUpdater;
import com.algo.segtree.api.Monoid;
import com.algo.segtree.api.RangeAggregator;
import com.algo.segtree.util.RangeChecks;

import lombok.extern.log4j.Log4j2;

/**
 * Lazy-propagation segment tree: range update, range query.
 *
 * <p>
 * Same flat layout as {@link SegmentTree}, with the leaf count rounded up to a
 * power of two ({@code capacity}) so every slot covers one contiguous block of
 * known length. Padding leaves hold the identity and are never covered by an
 * update.
 *
 * <h3>Deferred updates</h3>
 * Each internal slot may carry a pending update. Invariant: {@code tree[i]}
 * already reflects every update applied to slot {@code i}; a pending update on
 * {@code i} has not yet reached its children. Pending state is tracked with an
 * explicit flag array, so the update type needs neither an identity nor a
 * meaningful {@code equals}.
 *
 * <p>
 * Every call follows the same protocol:
 * <ol>
 * <li><b>Push:</b> walk root-down along the slots that contain a range
 * boundary without being aligned to it, and push their pending updates one
 * level down.</li>
 * <li><b>Apply / accumulate:</b> the bottom-up two-cursor walk of
 * {@link SegmentTree}. Updates land on the maximal slots inside the range.</li>
 * <li><b>Pull</b> (updates only): walk back up the same boundary slots and
 * recompute each as {@code apply(combine(left, right), pending)}.</li>
 * </ol>
 * Slots aligned to a boundary are skipped in both walks, which is what makes a
 * full-range call stop at the root.
 *
 * <p>
 * Complexity: construction O(n), {@link #query} and {@link #update} O(log n)
 * regardless of range length.
 *
 * @param <T> The aggregated value type.
 * @param <U> The update type.
 */
@Log4j2
public final class LazySegmentTree<T, U> implements RangeAggregator<T, U> {
    private final int size;
    private final int capacity;
    private final int height;
    private final Monoid<T> monoid;
    private final LazyUpdater<T, U> updater;

    private final Object[] tree;
    private final Object[] lazy;
    private final boolean[] pending;

    /**
     * Creates a tree with every position set to the identity.
     */
    public LazySegmentTree(int size, Monoid<T> monoid, LazyUpdater<T, U> updater) {
        this(filled(size, monoid), monoid, updater);
    }

    /**
     * Creates a tree over a copy of {@code values}.
     */
    public LazySegmentTree(List<? extends T> values, Monoid<T> monoid, LazyUpdater<T, U> updater) {
        this.monoid = Objects.requireNonNull(monoid, "monoid");
        this.updater = Objects.requireNonNull(updater, "updater");
        this.size = values.size();

        int cap = 1;
        while (cap < size) {
            cap <<= 1;
        }
        this.capacity = cap;
        this.height = Integer.numberOfTrailingZeros(cap);

        this.tree = new Object[2 * capacity];
        this.lazy = new Object[capacity];
        this.pending = new boolean[capacity];

        T identity = monoid.identity();
        for (int i = 0; i < capacity; i++) {
            tree[capacity + i] = i < size ? values.get(i) : identity;
        }
        for (int i = capacity - 1; i > 0; i--) {
            tree[i] = monoid.combine(at(2 * i), at(2 * i + 1));
        }
        tree[0] = identity;
        log.debug("Built lazy segment tree over {} positions (capacity {})", size, capacity);
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
        return query(index, index + 1);
    }

    @Override
    public T query(int from, int to) {
        RangeChecks.checkRange(from, to, 0, size);
        if (from == to) {
            return monoid.identity();
        }
        int l = from + capacity;
        int r = to + capacity;
        pushBoundaries(l, r);

        T leftResult = monoid.identity();
        T rightResult = monoid.identity();
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

    @Override
    public void update(int from, int to, U update) {
        RangeChecks.checkRange(from, to, 0, size);
        if (from == to) {
            return;
        }
        final int l0 = from + capacity;
        final int r0 = to + capacity;
        pushBoundaries(l0, r0);

        int l = l0;
        int r = r0;
        while (l < r) {
            if ((l & 1) == 1) {
                applyTo(l++, update);
            }
            if ((r & 1) == 1) {
                applyTo(--r, update);
            }
            l >>= 1;
            r >>= 1;
        }

        for (int i = 1; i <= height; i++) {
            if (((l0 >> i) << i) != l0) {
                pull(l0 >> i);
            }
            if (((r0 >> i) << i) != r0) {
                pull((r0 - 1) >> i);
            }
        }
    }

    /**
     * Pushes pending updates root-down on the slots that straddle a boundary of
     * the leaf range {@code [l, r)}.
     */
    private void pushBoundaries(int l, int r) {
        for (int i = height; i >= 1; i--) {
            if (((l >> i) << i) != l) {
                push(l >> i);
            }
            if (((r >> i) << i) != r) {
                push((r - 1) >> i);
            }
        }
    }

    private void push(int slot) {
        if (!pending[slot]) {
            return;
        }
        U u = lazyAt(slot);
        applyTo(2 * slot, u);
        applyTo(2 * slot + 1, u);
        pending[slot] = false;
        lazy[slot] = null;
    }

    private void applyTo(int slot, U update) {
        long length = length(slot);
        tree[slot] = updater.apply(at(slot), update, length);
        if (slot < capacity) {
            if (pending[slot]) {
                lazy[slot] = updater.compose(lazyAt(slot), update, length);
            } else {
                lazy[slot] = update;
                pending[slot] = true;
            }
        }
    }

    private void pull(int slot) {
        T value = monoid.combine(at(2 * slot), at(2 * slot + 1));
        if (pending[slot]) {
            value = updater.apply(value, lazyAt(slot), length(slot));
        }
        tree[slot] = value;
    }

    // Number of leaves under a slot; the root covers all of capacity.
    private long length(int slot) {
        int depth = 31 - Integer.numberOfLeadingZeros(slot);
        return (long) capacity >> depth;
    }

    @SuppressWarnings("unchecked")
    private T at(int slot) {
        return (T) tree[slot];
    }

    @SuppressWarnings("unchecked")
    private U lazyAt(int slot) {
        return (U) lazy[slot];
    }

    private static <T> List<T> filled(int size, Monoid<T> monoid) {
        if (size < 0) {
            throw new IllegalArgumentException("Negative size: " + size);
        }
        return Collections.nCopies(size, Objects.requireNonNull(monoid, "monoid").identity());
    }
}
