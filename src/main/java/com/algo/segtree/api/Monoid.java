package com.algo.segtree.api;

/**
 * Associative combine operation with an identity element.
 *
 * <p>
 * Every structure in this library aggregates values through a Monoid. The
 * operation must be associative, {@code combine(combine(a, b), c) ==
 * combine(a, combine(b, c))}, and {@code identity()} must satisfy
 * {@code combine(identity(), x) == combine(x, identity()) == x}.
 *
 * <p>
 * Commutativity is NOT required. Operand order is preserved by every query:
 * the left argument always covers the lower indices.
 *
 * @param <T> The aggregated value type.
 */
public interface Monoid<T> {

    /**
     * Returns the identity element. Used for "no contribution".
     */
    T identity();

    /**
     * Combines two aggregates. {@code left} covers positions strictly before
     * {@code right}.
     */
    T combine(T left, T right);

    /**
     * Returns the aggregate of the same positions folded in reverse order.
     *
     * <p>
     * Only path queries on a tree need this, because a path walks some chains
     * upward. Commutative monoids can rely on the default. Non-commutative ones
     * usually carry both directions inside the value.
     *
     * @param value An aggregate of some sequence {@code x1..xk}.
     * @return The aggregate of {@code xk..x1}.
     */
    default T reverse(T value) {
        return value;
    }
}
