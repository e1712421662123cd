package com.algo.segtree.core;

import com.algo.segtree.Fixtures;
import com.algo.segtree.util.Monoids;
import com.algo.segtree.util.Updaters;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.junit.Assert.*;

public class SegmentTreeTest {

    private static SegmentTree<Long, Long> sumTree(Long... values) {
        return new SegmentTree<>(Arrays.asList(values), Monoids.longSum(), Updaters.longAdd());
    }

    @Test
    public void testSumQueryAndPointAdd() {
        SegmentTree<Long, Long> tree = sumTree(1L, 2L, 3L, 4L);
        assertEquals(10L, (long) tree.query(0, 4));

        tree.update(1, 5L); // position 1 becomes 7
        assertEquals(7L, (long) tree.get(1));
        assertEquals(8L, (long) tree.query(0, 2));
        assertEquals(14L, (long) tree.query(1, 4));
    }

    @Test
    public void testIdentityConstructor() {
        SegmentTree<Long, Long> tree = new SegmentTree<>(5, Monoids.longSum(), Updaters.longAdd());
        assertEquals(5, tree.size());
        assertEquals(0L, (long) tree.query(0, 5));

        tree.update(4, 3L);
        tree.update(0, 2L);
        assertEquals(5L, (long) tree.query(0, 5));
        assertEquals(3L, (long) tree.query(1, 5));
        assertEquals(0L, (long) tree.query(1, 4));
    }

    @Test
    public void testEmptyRangeIsIdentity() {
        SegmentTree<Long, Long> tree = sumTree(1L, 2L, 3L);
        assertEquals(0L, (long) tree.query(2, 2));
        assertEquals(Long.MAX_VALUE, (long) new SegmentTree<>(List.of(4L, 5L), Monoids.longMin(),
                Updaters.<Long>replace()).query(1, 1));
    }

    @Test
    public void testEmptyTree() {
        SegmentTree<Long, Long> tree = new SegmentTree<>(0, Monoids.longSum(), Updaters.longAdd());
        assertEquals(0, tree.size());
        assertEquals(0L, (long) tree.query(0, 0));
    }

    @Test
    public void testNonCommutativeOrderOnOddSizes() {
        for (int n = 1; n <= 11; n++) {
            String[] letters = new String[n];
            for (int i = 0; i < n; i++) {
                letters[i] = String.valueOf((char) ('a' + i));
            }
            SegmentTree<String, String> tree = new SegmentTree<>(Arrays.asList(letters), Fixtures.CONCAT,
                    Updaters.replace());
            String all = String.join("", letters);
            for (int l = 0; l <= n; l++) {
                for (int r = l; r <= n; r++) {
                    assertEquals("n=" + n + " [" + l + "," + r + ")", all.substring(l, r), tree.query(l, r));
                }
            }
        }
    }

    @Test
    public void testReplaceKeepsOrder() {
        SegmentTree<String, String> tree = new SegmentTree<>(List.of("a", "b", "c", "d", "e"), Fixtures.CONCAT,
                Updaters.replace());
        tree.update(2, "X");
        assertEquals("bXd", tree.query(1, 4));
        assertEquals("abXde", tree.query(0, 5));
    }

    @Test
    public void testRandomMinAgainstBruteForce() {
        Random rng = new Random(7);
        int n = 37;
        long[] reference = new long[n];
        Long[] initial = new Long[n];
        for (int i = 0; i < n; i++) {
            reference[i] = rng.nextInt(1000);
            initial[i] = reference[i];
        }
        SegmentTree<Long, Long> tree = new SegmentTree<>(Arrays.asList(initial), Monoids.longMin(),
                Updaters.replace());

        for (int step = 0; step < 2000; step++) {
            if (rng.nextBoolean()) {
                int pos = rng.nextInt(n);
                long v = rng.nextInt(1000);
                reference[pos] = v;
                tree.update(pos, v);
            } else {
                int l = rng.nextInt(n + 1);
                int r = l + rng.nextInt(n + 1 - l);
                long expected = Long.MAX_VALUE;
                for (int i = l; i < r; i++) {
                    expected = Math.min(expected, reference[i]);
                }
                assertEquals(expected, (long) tree.query(l, r));
            }
        }
    }

    @Test
    public void testRangeUpdateAppliesToEachPosition() {
        SegmentTree<Long, Long> tree = sumTree(1L, 1L, 1L, 1L, 1L, 1L);
        tree.update(1, 4, 10L);
        assertEquals(36L, (long) tree.query(0, 6));
        assertEquals(11L, (long) tree.get(3));
        assertEquals(1L, (long) tree.get(4));
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testUpdateOutOfBounds() {
        sumTree(1L, 2L).update(2, 1L);
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testQueryPastEnd() {
        sumTree(1L, 2L).query(0, 3);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testReversedRange() {
        sumTree(1L, 2L).query(2, 1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeSize() {
        new SegmentTree<>(-1, Monoids.longSum(), Updaters.longAdd());
    }
}
