package com.algo.segtree.api;

/**
 * A fixed-size sequence that answers range aggregates and accepts range updates.
 *
 * <p>
 * All ranges are half-open: {@code [from, to)}. An empty range ({@code from == to})
 * aggregates to the monoid identity and an update over it is a no-op.
 *
 * <p>
 * Implementations are single-threaded. They do no internal locking and must
 * not be mutated concurrently.
 *
 * @param <T> The aggregated value type.
 * @param <U> The update type.
 */
public interface RangeAggregator<T, U> {

    /** Number of positions. */
    int size();

    /** The monoid the aggregates are combined with. */
    Monoid<T> monoid();

    /** Current value at {@code index}. */
    T get(int index);

    /**
     * Combines the values of {@code [from, to)} from left to right.
     *
     * @throws IndexOutOfBoundsException if the range is not within {@code [0, size())}.
     */
    T query(int from, int to);

    /**
     * Applies {@code update} to every position of {@code [from, to)}.
     *
     * @throws IndexOutOfBoundsException if the range is not within {@code [0, size())}.
     */
    void update(int from, int to, U update);
}
