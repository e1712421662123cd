package com.algo.segtree.util;

/**
 * Argument checks shared by the structures' public entry points.
 */
public final class RangeChecks {
    private RangeChecks() {
        // Utility class
    }

    /** Checks {@code 0 <= index < size}. */
    public static void checkIndex(long index, long size) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Index out of bounds: " + index + " (size=" + size + ")");
        }
    }

    /** Checks that {@code [from, to)} is a valid half-open range inside {@code [lo, hi)}. */
    public static void checkRange(long from, long to, long lo, long hi) {
        if (from > to) {
            throw new IllegalArgumentException("Invalid range: from (" + from + ") > to (" + to + ")");
        }
        if (from < lo || to > hi) {
            throw new IndexOutOfBoundsException(
                    "Range [" + from + ", " + to + ") outside of [" + lo + ", " + hi + ")");
        }
    }
}
