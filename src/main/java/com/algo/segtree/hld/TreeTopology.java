package com.algo.segtree.hld;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Topology -- CSR-encoded immutable undirected tree over nodes {@code 1..n}.
 *
 * <p>
 * The adjacency lists are flattened into two arrays, as in a Compressed Sparse
 * Row matrix:
 * <ul>
 * <li><b>neighbourOffset:</b> {@code neighbourOffset[v]} is where node
 * {@code v}'s neighbours start in {@code neighbourList};
 * {@code neighbourOffset[v + 1]} is where they end.</li>
 * <li><b>neighbourList:</b> all neighbour ids, one block per node.</li>
 * </ul>
 *
 * <p>
 * Node ids are 1-based; slot 0 is unused. Node 1 is the root by convention.
 * A built topology is guaranteed to be a tree: exactly {@code n - 1} edges, no
 * self loops, every node reachable from node 1.
 */
@Log4j2
public final class TreeTopology {
    private final int nodeCount;
    private final int[] neighbourOffset;
    private final int[] neighbourList;

    private TreeTopology(int nodeCount, int[] neighbourOffset, int[] neighbourList) {
        this.nodeCount = nodeCount;
        this.neighbourOffset = neighbourOffset;
        this.neighbourList = neighbourList;
    }

    /** Number of nodes, {@code n}. */
    public int nodeCount() {
        return nodeCount;
    }

    public int degree(int node) {
        checkNode(node);
        return neighbourOffset[node + 1] - neighbourOffset[node];
    }

    /** The {@code i}-th neighbour of {@code node}, in insertion order. */
    public int neighbour(int node, int i) {
        checkNode(node);
        int base = neighbourOffset[node];
        if (i < 0 || base + i >= neighbourOffset[node + 1]) {
            throw new IndexOutOfBoundsException("Neighbour index " + i + " out of bounds for node " + node);
        }
        return neighbourList[base + i];
    }

    public int neighboursStart(int node) {
        return neighbourOffset[node];
    }

    public int neighboursEnd(int node) {
        return neighbourOffset[node + 1];
    }

    public int neighbourAt(int flatIndex) {
        return neighbourList[flatIndex];
    }

    void checkNode(int node) {
        if (node < 1 || node > nodeCount) {
            throw new IllegalArgumentException("Unknown node: " + node + " (nodes are 1.." + nodeCount + ")");
        }
    }

    public static Builder builder(int nodeCount) {
        return new Builder(nodeCount);
    }

    /**
     * Builds a topology from 1-based adjacency lists. {@code adjacency[0]} is
     * ignored and {@code n = adjacency.length - 1}. Each edge may appear in one
     * or both endpoint lists.
     */
    public static TreeTopology fromAdjacency(int[][] adjacency) {
        if (adjacency.length == 0) {
            throw new IllegalArgumentException("Adjacency must have a slot 0 and at least one node");
        }
        Builder builder = new Builder(adjacency.length - 1);
        Set<Long> seen = new HashSet<>();
        for (int u = 1; u < adjacency.length; u++) {
            for (int v : adjacency[u]) {
                long key = (long) Math.min(u, v) << 32 | Math.max(u, v);
                if (seen.add(key)) {
                    builder.addEdge(u, v);
                }
            }
        }
        return builder.build();
    }

    /**
     * Builder for constructing the TreeTopology.
     * Handles validation that the edges form a single tree.
     */
    public static final class Builder {
        private final int nodeCount;
        private final List<int[]> edges = new ArrayList<>();

        private Builder(int nodeCount) {
            if (nodeCount < 1) {
                throw new IllegalArgumentException("A tree needs at least one node, got " + nodeCount);
            }
            this.nodeCount = nodeCount;
        }

        public Builder addEdge(int u, int v) {
            requireNode(u);
            requireNode(v);
            if (u == v) {
                throw new IllegalArgumentException("Self loop on node " + u);
            }
            edges.add(new int[] { u, v });
            return this;
        }

        private void requireNode(int node) {
            if (node < 1 || node > nodeCount) {
                throw new IllegalArgumentException("Unknown node: " + node + " (nodes are 1.." + nodeCount + ")");
            }
        }

        /**
         * Compiles the edges to CSR form and checks that they form a tree rooted
         * at node 1.
         */
        public TreeTopology build() {
            if (edges.size() != nodeCount - 1) {
                throw new IllegalStateException(
                        "A tree with " + nodeCount + " nodes needs " + (nodeCount - 1) + " edges, got " + edges.size());
            }

            // 1. Degrees -> offsets
            int[] offsets = new int[nodeCount + 2];
            for (int[] e : edges) {
                offsets[e[0] + 1]++;
                offsets[e[1] + 1]++;
            }
            for (int v = 1; v <= nodeCount + 1; v++) {
                offsets[v] += offsets[v - 1];
            }

            // 2. Scatter both directions of every edge
            int[] flat = new int[2 * edges.size()];
            int[] cursor = Arrays.copyOf(offsets, offsets.length);
            for (int[] e : edges) {
                flat[cursor[e[0]]++] = e[1];
                flat[cursor[e[1]]++] = e[0];
            }

            // 3. Connectivity from the root; with n - 1 edges this also rules out cycles
            boolean[] reached = new boolean[nodeCount + 1];
            int[] queue = new int[nodeCount];
            int head = 0, tail = 0;
            queue[tail++] = 1;
            reached[1] = true;
            while (head < tail) {
                int cur = queue[head++];
                for (int i = offsets[cur]; i < offsets[cur + 1]; i++) {
                    int next = flat[i];
                    if (!reached[next]) {
                        reached[next] = true;
                        queue[tail++] = next;
                    }
                }
            }
            if (tail != nodeCount) {
                throw new IllegalStateException(
                        "Tree is disconnected or has a cycle! Reached " + tail + " of " + nodeCount + " nodes from root 1");
            }

            log.debug("Built tree topology: {} nodes, {} edges", nodeCount, edges.size());
            return new TreeTopology(nodeCount, offsets, flat);
        }
    }
}
