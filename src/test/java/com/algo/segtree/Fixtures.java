package com.algo.segtree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

import com.algo.segtree.api.LazyUpdater;
import com.algo.segtree.api.Monoid;
import com.algo.segtree.hld.TreeTopology;
import com.algo.segtree.util.Monoids;

/**
 * Shared strategies and reference helpers for the tests.
 */
public final class Fixtures {
    private Fixtures() {
    }

    public static final long MOD = 1_000_000_007L;

    // ── Non-commutative strategies ───────────────────────────────

    /** String concatenation; order sensitive. */
    public static final Monoid<String> CONCAT = Monoids.of("", String::concat);

    /** "Overwrite every position with this character" under CONCAT. */
    public static final LazyUpdater<String, Character> FILL = new LazyUpdater<>() {
        @Override
        public String apply(String value, Character c, long length) {
            return String.valueOf(c).repeat((int) length);
        }

        @Override
        public Character compose(Character pending, Character incoming, long length) {
            return incoming;
        }
    };

    /** A string together with its reverse, so a path can be read in either direction. */
    public record Word(String forward, String backward) {
        public static Word of(String s) {
            return new Word(s, new StringBuilder(s).reverse().toString());
        }
    }

    public static final Monoid<Word> WORD = new Monoid<>() {
        private final Word empty = new Word("", "");

        @Override
        public Word identity() {
            return empty;
        }

        @Override
        public Word combine(Word left, Word right) {
            return new Word(left.forward() + right.forward(), right.backward() + left.backward());
        }

        @Override
        public Word reverse(Word value) {
            return new Word(value.backward(), value.forward());
        }
    };

    public static final LazyUpdater<Word, Character> WORD_FILL = new LazyUpdater<>() {
        @Override
        public Word apply(Word value, Character c, long length) {
            String s = String.valueOf(c).repeat((int) length);
            return new Word(s, s);
        }

        @Override
        public Character compose(Character pending, Character incoming, long length) {
            return incoming;
        }
    };

    // ── Affine updates: x -> mul * x + add (mod MOD) ─────────────

    /** Affine map; composition is not commutative. */
    public record Affine(long mul, long add) {
        public long applyTo(long x) {
            return (mul * x + add) % MOD;
        }
    }

    public static final Monoid<Long> SUM_MOD = Monoids.of(0L, (a, b) -> (a + b) % MOD);

    public static final LazyUpdater<Long, Affine> AFFINE_ON_SUM = new LazyUpdater<>() {
        @Override
        public Long apply(Long value, Affine f, long length) {
            return (f.mul() * value + f.add() * (length % MOD)) % MOD;
        }

        @Override
        public Affine compose(Affine pending, Affine incoming, long length) {
            return new Affine(pending.mul() * incoming.mul() % MOD,
                    (pending.add() * incoming.mul() + incoming.add()) % MOD);
        }
    };

    public static Affine randomAffine(Random rng) {
        return new Affine(1 + rng.nextInt(5), rng.nextInt(100));
    }

    // ── Trees ────────────────────────────────────────────────────

    /**
     * Random tree on {@code 1..n}: node labels other than the root are
     * shuffled, each node attaches to a random earlier node.
     */
    public static int[][] randomTreeEdges(int n, Random rng) {
        List<Integer> labels = new ArrayList<>();
        for (int v = 2; v <= n; v++) {
            labels.add(v);
        }
        Collections.shuffle(labels, rng);
        labels.add(0, 1);
        int[][] edges = new int[n - 1][];
        for (int i = 1; i < n; i++) {
            int p = labels.get(rng.nextInt(i));
            edges[i - 1] = rng.nextBoolean() ? new int[] { p, labels.get(i) } : new int[] { labels.get(i), p };
        }
        return edges;
    }

    public static TreeTopology topology(int n, int[][] edges) {
        TreeTopology.Builder b = TreeTopology.builder(n);
        for (int[] e : edges) {
            b.addEdge(e[0], e[1]);
        }
        return b.build();
    }

    /**
     * Plain parent/depth arrays from a BFS at node 1, for reference walks.
     */
    public static final class ReferenceTree {
        public final int n;
        public final int[] parent;
        public final int[] depth;
        private final List<List<Integer>> adj = new ArrayList<>();

        public ReferenceTree(int n, int[][] edges) {
            this.n = n;
            for (int v = 0; v <= n; v++) {
                adj.add(new ArrayList<>());
            }
            for (int[] e : edges) {
                adj.get(e[0]).add(e[1]);
                adj.get(e[1]).add(e[0]);
            }
            parent = new int[n + 1];
            depth = new int[n + 1];
            boolean[] seen = new boolean[n + 1];
            int[] queue = new int[n];
            int head = 0, tail = 0;
            queue[tail++] = 1;
            seen[1] = true;
            while (head < tail) {
                int cur = queue[head++];
                for (int next : adj.get(cur)) {
                    if (!seen[next]) {
                        seen[next] = true;
                        parent[next] = cur;
                        depth[next] = depth[cur] + 1;
                        queue[tail++] = next;
                    }
                }
            }
        }

        /** Nodes on the path from u to v, in order, both included. */
        public List<Integer> path(int u, int v) {
            List<Integer> fromU = new ArrayList<>();
            List<Integer> fromV = new ArrayList<>();
            while (u != v) {
                if (depth[u] >= depth[v]) {
                    fromU.add(u);
                    u = parent[u];
                } else {
                    fromV.add(v);
                    v = parent[v];
                }
            }
            fromU.add(u);
            Collections.reverse(fromV);
            fromU.addAll(fromV);
            return fromU;
        }

        public int lca(int u, int v) {
            List<Integer> p = path(u, v);
            int best = p.get(0);
            for (int x : p) {
                if (depth[x] < depth[best]) {
                    best = x;
                }
            }
            return best;
        }

        public boolean isInSubtree(int x, int root) {
            while (x != 0) {
                if (x == root) {
                    return true;
                }
                x = parent[x];
            }
            return false;
        }

        public int[] subtreeNodes(int root) {
            return IntStream.rangeClosed(1, n).filter(x -> isInSubtree(x, root)).toArray();
        }
    }
}
