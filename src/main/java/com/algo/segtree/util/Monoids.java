package com.algo.segtree.util;

import java.util.Objects;
import java.util.function.BinaryOperator;

import com.algo.segtree.api.Monoid;

/**
 * Standard implementations of Monoid.
 */
public final class Monoids {
    private Monoids() {
        // Utility class
    }

    private static final Monoid<Long> LONG_SUM = of(0L, Long::sum);
    private static final Monoid<Long> LONG_MIN = of(Long.MAX_VALUE, Math::min);
    private static final Monoid<Long> LONG_MAX = of(Long.MIN_VALUE, Math::max);

    /** Sum, identity 0. Overflow wraps. */
    public static Monoid<Long> longSum() {
        return LONG_SUM;
    }

    /** Minimum, identity {@code Long.MAX_VALUE}. */
    public static Monoid<Long> longMin() {
        return LONG_MIN;
    }

    /** Maximum, identity {@code Long.MIN_VALUE}. */
    public static Monoid<Long> longMax() {
        return LONG_MAX;
    }

    /**
     * Builds a monoid from an identity and an associative operation. The
     * result's {@link Monoid#reverse} is the identity function, which is only
     * right for commutative operations.
     */
    public static <T> Monoid<T> of(T identity, BinaryOperator<T> operator) {
        Objects.requireNonNull(operator, "operator");
        return new Monoid<>() {
            @Override
            public T identity() {
                return identity;
            }

            @Override
            public T combine(T left, T right) {
                return operator.apply(left, right);
            }
        };
    }
}
