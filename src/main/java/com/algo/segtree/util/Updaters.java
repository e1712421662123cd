package com.algo.segtree.util;

import com.algo.segtree.api.LazyUpdater;
import com.algo.segtree.api.PointUpdater;

/**
 * Standard implementations of PointUpdater and LazyUpdater for {@code long}
 * values.
 *
 * <p>
 * Lazy updaters are tied to the monoid they are used with: {@link #longAddToSum()}
 * scales by length and is only valid under {@link Monoids#longSum()}, while
 * {@link #longAddToExtremum()} is valid under {@link Monoids#longMin()} and
 * {@link Monoids#longMax()}. The latter leaves {@code Long.MAX_VALUE} and
 * {@code Long.MIN_VALUE} untouched, since those are the identities of min and
 * max and stand for "no position" rather than a stored value.
 */
public final class Updaters {
    private Updaters() {
        // Utility class
    }

    /** Point update replacing the old value. */
    public static <T> PointUpdater<T, T> replace() {
        return (value, update) -> update;
    }

    /** Point update adding a delta. */
    public static PointUpdater<Long, Long> longAdd() {
        return Long::sum;
    }

    /** "Add delta to every element" under a sum. */
    public static LazyUpdater<Long, Long> longAddToSum() {
        return new LazyUpdater<>() {
            @Override
            public Long apply(Long value, Long delta, long length) {
                return value + delta * length;
            }

            @Override
            public Long compose(Long pending, Long incoming, long length) {
                return pending + incoming;
            }
        };
    }

    /**
     * "Add delta to every element" under a min or max. An aggregate equal to the
     * min or max identity is returned as is.
     */
    public static LazyUpdater<Long, Long> longAddToExtremum() {
        return new LazyUpdater<>() {
            @Override
            public Long apply(Long value, Long delta, long length) {
                if (value == Long.MAX_VALUE || value == Long.MIN_VALUE) {
                    return value;
                }
                return value + delta;
            }

            @Override
            public Long compose(Long pending, Long incoming, long length) {
                return pending + incoming;
            }
        };
    }

    /** "Set every element to x" under a sum. */
    public static LazyUpdater<Long, Long> longAssignToSum() {
        return new LazyUpdater<>() {
            @Override
            public Long apply(Long value, Long assigned, long length) {
                return assigned * length;
            }

            @Override
            public Long compose(Long pending, Long incoming, long length) {
                return incoming;
            }
        };
    }

    /** "Set every element to x" under a min or max. */
    public static LazyUpdater<Long, Long> longAssignToExtremum() {
        return new LazyUpdater<>() {
            @Override
            public Long apply(Long value, Long assigned, long length) {
                return assigned;
            }

            @Override
            public Long compose(Long pending, Long incoming, long length) {
                return incoming;
            }
        };
    }
}
