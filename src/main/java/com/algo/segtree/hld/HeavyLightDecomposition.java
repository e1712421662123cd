package com.algo.segtree.hld;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.IntFunction;

import com.algo.segtree.api.Monoid;
import com.algo.segtree.api.RangeAggregator;

import lombok.extern.log4j.Log4j2;

/**
 * Heavy-Light Decomposition: path and subtree operations on a tree, answered by
 * a linear range structure.
 *
 * <p>
 * The tree is cut into vertex-disjoint heavy chains and the nodes are numbered
 * in a preorder that visits the heavy child first. Every chain then occupies a
 * contiguous block of preorder numbers, and so does every subtree. A path
 * between two nodes crosses O(log n) chains, so a path operation becomes
 * O(log n) range operations on the backend, O(log^2 n) in total.
 *
 * <h3>Construction</h3>
 * <ol>
 * <li><b>Sizing pass</b> (children before parents): parent, depth, subtree
 * size, and the heavy child (largest subtree, first one on ties).</li>
 * <li><b>Chaining pass</b> (preorder, heavy child first): preorder numbers
 * from 1, and the chain head of every node. The heavy child inherits its
 * parent's head; a light child starts a new chain.</li>
 * </ol>
 * Both passes use explicit stacks and queues, so tree depth is not limited by
 * the call stack. The topology is never modified.
 *
 * <h3>Ownership</h3>
 * The backend is created once during construction, either empty from its size
 * or by a {@link BackendFactory} from initial values, and is owned by this
 * instance. Path folds use the backend's own {@link RangeAggregator#monoid()}.
 * Node {@code v} lives at backend index {@code preorder(v) - 1}.
 *
 * @param <T> The aggregated value type.
 * @param <U> The update type.
 */
@Log4j2
public final class HeavyLightDecomposition<T, U> {
    /** Returned when an ancestor query walks past the root. */
    public static final int NO_SUCH_NODE = -1;

    private static final int ROOT = 1;

    private final TreeTopology topology;
    private final Monoid<T> monoid;
    private final int n;

    private final int[] parent;
    private final int[] depth;
    private final int[] heavyChild;
    private final int[] chainHead;
    private final int[] preorder;
    private final int[] nodeAtPreorder;
    // Exclusive end of the preorder block of v's subtree.
    private final int[] subtreeEnd;
    private int chainCount;

    private final RangeAggregator<T, U> backend;

    /**
     * Decomposes {@code topology} over an all-identity backend of one position
     * per node, created by {@code backendOfSize}.
     */
    public HeavyLightDecomposition(TreeTopology topology, IntFunction<? extends RangeAggregator<T, U>> backendOfSize) {
        this(topology, sized(backendOfSize));
    }

    /**
     * Decomposes {@code topology} with node {@code v} starting at
     * {@code initialValue.apply(v)}. The factory receives the values in
     * preorder.
     */
    public HeavyLightDecomposition(TreeTopology topology, IntFunction<? extends T> initialValue,
            BackendFactory<T, U> backendFactory) {
        this(topology, seeded(initialValue, backendFactory));
    }

    private HeavyLightDecomposition(TreeTopology topology, Function<int[], ? extends RangeAggregator<T, U>> backendFor) {
        this.topology = Objects.requireNonNull(topology, "topology");

        this.n = topology.nodeCount();
        this.parent = new int[n + 1];
        this.depth = new int[n + 1];
        this.heavyChild = new int[n + 1];
        this.chainHead = new int[n + 1];
        this.preorder = new int[n + 1];
        this.nodeAtPreorder = new int[n + 1];
        this.subtreeEnd = new int[n + 1];

        int[] size = computeSizes();
        assignChains(size);

        this.backend = Objects.requireNonNull(backendFor.apply(nodeAtPreorder), "backend");
        if (backend.size() != n) {
            throw new IllegalStateException(
                    "Backend has " + backend.size() + " positions, expected one per node (" + n + ")");
        }
        this.monoid = Objects.requireNonNull(backend.monoid(), "backend monoid");
        log.debug("Decomposed tree of {} nodes into {} heavy chains", n, chainCount);
    }

    private static <T, U> Function<int[], RangeAggregator<T, U>> sized(
            IntFunction<? extends RangeAggregator<T, U>> backendOfSize) {
        Objects.requireNonNull(backendOfSize, "backendOfSize");
        return order -> backendOfSize.apply(order.length - 1);
    }

    private static <T, U> Function<int[], RangeAggregator<T, U>> seeded(IntFunction<? extends T> initialValue,
            BackendFactory<T, U> backendFactory) {
        Objects.requireNonNull(initialValue, "initialValue");
        Objects.requireNonNull(backendFactory, "backendFactory");
        return order -> {
            List<T> values = new ArrayList<>(order.length - 1);
            for (int p = 1; p < order.length; p++) {
                values.add(initialValue.apply(order[p]));
            }
            return backendFactory.create(values);
        };
    }

    /**
     * Sizing pass. Returns subtree sizes; fills parent, depth and heavyChild.
     */
    private int[] computeSizes() {
        // BFS order lists every parent before its children.
        int[] order = new int[n];
        int head = 0, tail = 0;
        order[tail++] = ROOT;
        while (head < tail) {
            int cur = order[head++];
            for (int i = topology.neighboursStart(cur); i < topology.neighboursEnd(cur); i++) {
                int next = topology.neighbourAt(i);
                if (next == parent[cur]) {
                    continue;
                }
                parent[next] = cur;
                depth[next] = depth[cur] + 1;
                order[tail++] = next;
            }
        }

        int[] size = new int[n + 1];
        for (int i = n - 1; i >= 0; i--) {
            int v = order[i];
            size[v]++;
            if (parent[v] != 0) {
                size[parent[v]] += size[v];
            }
        }

        for (int v = 1; v <= n; v++) {
            int heavy = 0;
            for (int i = topology.neighboursStart(v); i < topology.neighboursEnd(v); i++) {
                int child = topology.neighbourAt(i);
                if (child != parent[v] && (heavy == 0 || size[child] > size[heavy])) {
                    heavy = child;
                }
            }
            heavyChild[v] = heavy;
        }
        return size;
    }

    /**
     * Chaining pass. Fills preorder, nodeAtPreorder, subtreeEnd and chainHead.
     */
    private void assignChains(int[] size) {
        int[] stack = new int[n];
        int top = 0;
        stack[top++] = ROOT;
        chainHead[ROOT] = ROOT;
        chainCount = 1;

        int counter = 1;
        while (top > 0) {
            int v = stack[--top];
            preorder[v] = counter;
            nodeAtPreorder[counter] = v;
            subtreeEnd[v] = counter + size[v];
            counter++;

            for (int i = topology.neighboursStart(v); i < topology.neighboursEnd(v); i++) {
                int child = topology.neighbourAt(i);
                if (child == parent[v] || child == heavyChild[v]) {
                    continue;
                }
                chainHead[child] = child;
                chainCount++;
                stack[top++] = child;
            }
            // Pushed last so it is numbered right after v.
            int heavy = heavyChild[v];
            if (heavy != 0) {
                chainHead[heavy] = chainHead[v];
                stack[top++] = heavy;
            }
        }
    }

    // ── Path operations ──────────────────────────────────────────

    /**
     * Folds the values on the path from {@code u} to {@code v}, both included,
     * in that order.
     *
     * <p>
     * Segments climbed from the {@code u} side are read against preorder, so
     * they go through {@link Monoid#reverse}; segments on the {@code v} side are
     * prepended to the right partial result.
     */
    public T queryPath(int u, int v) {
        checkNode(u);
        checkNode(v);
        T fromU = monoid.identity();
        T toV = monoid.identity();
        while (chainHead[u] != chainHead[v]) {
            if (depth[chainHead[u]] >= depth[chainHead[v]]) {
                T segment = backend.query(slot(chainHead[u]), slot(u) + 1);
                fromU = monoid.combine(fromU, monoid.reverse(segment));
                u = parent[chainHead[u]];
            } else {
                T segment = backend.query(slot(chainHead[v]), slot(v) + 1);
                toV = monoid.combine(segment, toV);
                v = parent[chainHead[v]];
            }
        }
        T middle;
        if (preorder[u] <= preorder[v]) {
            middle = backend.query(slot(u), slot(v) + 1);
        } else {
            middle = monoid.reverse(backend.query(slot(v), slot(u) + 1));
        }
        return monoid.combine(monoid.combine(fromU, middle), toV);
    }

    /**
     * Applies {@code update} to every node on the path from {@code u} to
     * {@code v}, both included.
     */
    public void updatePath(int u, int v, U update) {
        checkNode(u);
        checkNode(v);
        while (chainHead[u] != chainHead[v]) {
            if (depth[chainHead[u]] < depth[chainHead[v]]) {
                int tmp = u;
                u = v;
                v = tmp;
            }
            backend.update(slot(chainHead[u]), slot(u) + 1, update);
            u = parent[chainHead[u]];
        }
        if (preorder[u] > preorder[v]) {
            int tmp = u;
            u = v;
            v = tmp;
        }
        backend.update(slot(u), slot(v) + 1, update);
    }

    // ── Node and subtree operations ──────────────────────────────

    public T queryNode(int v) {
        checkNode(v);
        return backend.get(slot(v));
    }

    public void updateNode(int v, U update) {
        checkNode(v);
        backend.update(slot(v), slot(v) + 1, update);
    }

    /**
     * Folds the values of {@code v}'s subtree in preorder.
     */
    public T querySubtree(int v) {
        checkNode(v);
        return backend.query(slot(v), subtreeEnd[v] - 1);
    }

    public void updateSubtree(int v, U update) {
        checkNode(v);
        backend.update(slot(v), subtreeEnd[v] - 1, update);
    }

    // ── Structure ────────────────────────────────────────────────

    /** Lowest common ancestor of {@code u} and {@code v}. */
    public int lca(int u, int v) {
        checkNode(u);
        checkNode(v);
        while (chainHead[u] != chainHead[v]) {
            if (depth[chainHead[u]] < depth[chainHead[v]]) {
                v = parent[chainHead[v]];
            } else {
                u = parent[chainHead[u]];
            }
        }
        return depth[u] <= depth[v] ? u : v;
    }

    /** Number of edges on the path between {@code u} and {@code v}. */
    public int distance(int u, int v) {
        int ancestor = lca(u, v);
        return depth[u] + depth[v] - 2 * depth[ancestor];
    }

    /**
     * The ancestor {@code k} levels above {@code v}; {@code v} itself for
     * {@code k == 0}.
     *
     * @return The ancestor, or {@link #NO_SUCH_NODE} if {@code k} exceeds
     *         {@code v}'s depth.
     */
    public int kthAncestor(int v, int k) {
        checkNode(v);
        if (k < 0) {
            throw new IllegalArgumentException("Negative ancestor distance: " + k);
        }
        if (k > depth[v]) {
            return NO_SUCH_NODE;
        }
        int targetDepth = depth[v] - k;
        while (depth[chainHead[v]] > targetDepth) {
            v = parent[chainHead[v]];
        }
        // A chain is a contiguous preorder block, one node per depth.
        return nodeAtPreorder[preorder[v] - (depth[v] - targetDepth)];
    }

    public int nodeCount() {
        return n;
    }

    public int chainCount() {
        return chainCount;
    }

    public int depth(int v) {
        checkNode(v);
        return depth[v];
    }

    /** Parent of {@code v}, or {@link #NO_SUCH_NODE} for the root. */
    public int parent(int v) {
        checkNode(v);
        return v == ROOT ? NO_SUCH_NODE : parent[v];
    }

    public int chainHead(int v) {
        checkNode(v);
        return chainHead[v];
    }

    /** Preorder number of {@code v}, in {@code [1, n]}. */
    public int preorder(int v) {
        checkNode(v);
        return preorder[v];
    }

    /** Inverse of {@link #preorder(int)}. */
    public int nodeAtPreorder(int number) {
        if (number < 1 || number > n) {
            throw new IndexOutOfBoundsException("Preorder number out of bounds: " + number + " (n=" + n + ")");
        }
        return nodeAtPreorder[number];
    }

    private int slot(int v) {
        return preorder[v] - 1;
    }

    private void checkNode(int v) {
        topology.checkNode(v);
    }
}
