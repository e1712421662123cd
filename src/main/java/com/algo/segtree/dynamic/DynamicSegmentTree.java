package com.algo.segtree.dynamic;

import java.util.Objects;

import com.algo.segtree.api.LazyUpdater;
import com.algo.segtree.api.Monoid;

import lombok.extern.log4j.Log4j2;

/**
 * Implicit segment tree over a {@code long} index domain.
 *
 * <p>
 * Each instance is both a node and the subtree rooted at it. A node covers the
 * inclusive index block {@code [start, end]} and owns at most two children,
 * which are created only when a call has to look inside the node. A missing
 * child stands for a block that has never been touched and is implicitly all
 * identity. Ranges that fully cover a node are answered or updated at that
 * node without allocating anything below it, so memory grows with the number
 * of calls, O(k log D), and not with the domain size D.
 *
 * <p>
 * Pending updates follow the same rules as
 * {@link com.algo.segtree.core.LazySegmentTree}: a node's value already
 * includes its own pending update, which is pushed to both children before any
 * call descends.
 *
 * <p>
 * Public calls take half-open ranges {@code [from, to)} like the other
 * structures. The covered length {@code end - start + 1} must fit in a
 * {@code long}, and {@code end} must be below {@code Long.MAX_VALUE} so that
 * the last index is reachable through an exclusive bound.
 *
 * @param <T> The aggregated value type.
 * @param <U> The update type.
 */
@Log4j2
public final class DynamicSegmentTree<T, U> {
    private final long start;
    private final long end;
    private final Monoid<T> monoid;
    private final LazyUpdater<T, U> updater;

    private T value;
    private U lazy;
    private boolean pending;

    private DynamicSegmentTree<T, U> left;
    private DynamicSegmentTree<T, U> right;

    /**
     * Creates an all-identity tree over the inclusive domain {@code [start, end]}.
     */
    public DynamicSegmentTree(long start, long end, Monoid<T> monoid, LazyUpdater<T, U> updater) {
        if (start > end) {
            throw new IllegalArgumentException("Empty domain: [" + start + ", " + end + "]");
        }
        if (end == Long.MAX_VALUE || end - start + 1 <= 0) {
            throw new IllegalArgumentException("Domain too large: [" + start + ", " + end + "]");
        }
        this.start = start;
        this.end = end;
        this.monoid = Objects.requireNonNull(monoid, "monoid");
        this.updater = Objects.requireNonNull(updater, "updater");
        this.value = monoid.identity();
        log.debug("Created dynamic segment tree over [{}, {}]", start, end);
    }

    private DynamicSegmentTree(DynamicSegmentTree<T, U> parent, long start, long end) {
        this.start = start;
        this.end = end;
        this.monoid = parent.monoid;
        this.updater = parent.updater;
        this.value = monoid.identity();
    }

    /** First index of the domain. */
    public long start() {
        return start;
    }

    /** Last index of the domain (inclusive). */
    public long end() {
        return end;
    }

    /** Current value at {@code index}. */
    public T get(long index) {
        if (index < start || index > end) {
            throw new IndexOutOfBoundsException(
                    "Index out of bounds: " + index + " (domain=[" + start + ", " + end + "])");
        }
        return queryClosed(index, index);
    }

    /**
     * Combines the values of {@code [from, to)} from left to right.
     */
    public T query(long from, long to) {
        checkRange(from, to);
        if (from == to) {
            return monoid.identity();
        }
        return queryClosed(from, to - 1);
    }

    /**
     * Applies {@code update} to every index of {@code [from, to)}.
     */
    public void update(long from, long to, U update) {
        checkRange(from, to);
        if (from == to) {
            return;
        }
        updateClosed(from, to - 1, update);
    }

    /**
     * Number of nodes materialised in this subtree, this node included.
     */
    public long nodeCount() {
        long count = 1;
        if (left != null) {
            count += left.nodeCount() + right.nodeCount();
        }
        return count;
    }

    /**
     * Releases every child and resets the whole domain to the identity.
     */
    public void clear() {
        left = null;
        right = null;
        value = monoid.identity();
        lazy = null;
        pending = false;
    }

    // Inclusive [l, r] from here on.

    private T queryClosed(long l, long r) {
        if (r < start || end < l) {
            return monoid.identity();
        }
        if (l <= start && end <= r) {
            return value;
        }
        pushDown();
        return monoid.combine(left.queryClosed(l, r), right.queryClosed(l, r));
    }

    private void updateClosed(long l, long r, U update) {
        if (r < start || end < l) {
            return;
        }
        if (l <= start && end <= r) {
            applyHere(update);
            return;
        }
        pushDown();
        left.updateClosed(l, r, update);
        right.updateClosed(l, r, update);
        value = monoid.combine(left.value, right.value);
    }

    private void applyHere(U update) {
        long length = end - start + 1;
        value = updater.apply(value, update, length);
        if (pending) {
            lazy = updater.compose(lazy, update, length);
        } else {
            lazy = update;
            pending = true;
        }
    }

    /**
     * Materialises both children if needed and hands them this node's pending
     * update.
     */
    private void pushDown() {
        if (left == null) {
            long middle = start + (end - start) / 2;
            left = new DynamicSegmentTree<>(this, start, middle);
            right = new DynamicSegmentTree<>(this, middle + 1, end);
        }
        if (!pending) {
            return;
        }
        left.applyHere(lazy);
        right.applyHere(lazy);
        lazy = null;
        pending = false;
    }

    private void checkRange(long from, long to) {
        if (from > to) {
            throw new IllegalArgumentException("Invalid range: from (" + from + ") > to (" + to + ")");
        }
        if (from < to && (from < start || to - 1 > end)) {
            throw new IndexOutOfBoundsException(
                    "Range [" + from + ", " + to + ") outside of domain [" + start + ", " + end + "]");
        }
    }
}
