package org.span.network;

import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Deterministic Steiner-tree approximation over hop counts.
 * <p>
 * Kou-Markowsky-Berman construction:
 * </p>
 * <pre>
 * 1. MST of the metric closure restricted to the terminals
 * 2. expand each closure edge into a stored shortest path
 * 3. spanning tree of the union of those paths
 * 4. prune non-terminal leaves until none remain
 * </pre>
 * <p>
 * The result is at most twice the optimum and exact for one or two terminals.
 * Every tie is broken towards the lowest dense index, so the same terminal set always
 * yields the same tree, which downstream consumers of the distribution tree rely on.
 * </p>
 */
final class SteinerTreeSolver {
    private final ServerNetwork network;

    SteinerTreeSolver(ServerNetwork network) {
        this.network = network;
    }

    /**
     * Solves one terminal set given in dense index space.
     */
    SteinerTree solve(int[] denseTerminals) {
        int[] terminals = new IntRBTreeSet(denseTerminals).toIntArray();
        if (terminals.length == 1) {
            return new SteinerTree(new int[]{network.serverIndex().toExternal(terminals[0])}, List.of());
        }

        int[][] closureEdges = closureSpanningTree(terminals);
        LongOpenHashSet unionEdges = expandPaths(closureEdges);
        int[] treeParent = spanningTree(terminals[0], unionEdges);
        pruneNonTerminalLeaves(terminals, treeParent);
        return toSteinerTree(terminals[0], treeParent);
    }

    /**
     * Prim's algorithm on the terminal metric closure.
     */
    private int[][] closureSpanningTree(int[] terminals) {
        int k = terminals.length;
        boolean[] inTree = new boolean[k];
        int[] best = new int[k];
        int[] bestFrom = new int[k];
        Arrays.fill(best, Integer.MAX_VALUE);
        best[0] = 0;
        bestFrom[0] = -1;

        int[][] edges = new int[k - 1][];
        int edgeCount = 0;
        for (int step = 0; step < k; step++) {
            int next = -1;
            for (int i = 0; i < k; i++) {
                if (!inTree[i] && (next < 0 || best[i] < best[next])) {
                    next = i;
                }
            }
            inTree[next] = true;
            if (bestFrom[next] >= 0) {
                edges[edgeCount++] = new int[]{terminals[bestFrom[next]], terminals[next]};
            }
            for (int i = 0; i < k; i++) {
                if (inTree[i]) {
                    continue;
                }
                int d = network.denseDistance(terminals[next], terminals[i]);
                if (d < best[i]) {
                    best[i] = d;
                    bestFrom[i] = next;
                }
            }
        }
        return edges;
    }

    private LongOpenHashSet expandPaths(int[][] closureEdges) {
        LongOpenHashSet union = new LongOpenHashSet();
        for (int[] edge : closureEdges) {
            int source = edge[0];
            int node = edge[1];
            while (node != source) {
                int previous = network.denseParent(source, node);
                union.add(linkKey(previous, node));
                node = previous;
            }
        }
        return union;
    }

    /**
     * Breadth-first spanning tree of the union subgraph; {@code -1} marks nodes outside it.
     */
    private int[] spanningTree(int root, LongOpenHashSet unionEdges) {
        int n = network.serverCount();
        int[] treeParent = new int[n];
        Arrays.fill(treeParent, -1);
        boolean[] visited = new boolean[n];
        int[] queue = new int[n];
        int head = 0;
        int tail = 0;
        visited[root] = true;
        treeParent[root] = root;
        queue[tail++] = root;

        ServerNetwork.NeighbourIterator iterator = new ServerNetwork.NeighbourIterator(network);
        while (head < tail) {
            int node = queue[head++];
            iterator.resetForServer(node);
            while (iterator.hasNext()) {
                int next = iterator.next();
                if (!visited[next] && unionEdges.contains(linkKey(node, next))) {
                    visited[next] = true;
                    treeParent[next] = node;
                    queue[tail++] = next;
                }
            }
        }
        return treeParent;
    }

    private void pruneNonTerminalLeaves(int[] terminals, int[] treeParent) {
        int n = treeParent.length;
        boolean[] terminal = new boolean[n];
        for (int t : terminals) {
            terminal[t] = true;
        }
        int[] childCount = new int[n];
        for (int node = 0; node < n; node++) {
            if (treeParent[node] >= 0 && treeParent[node] != node) {
                childCount[treeParent[node]]++;
            }
        }
        int[] stack = new int[n];
        int top = 0;
        for (int node = 0; node < n; node++) {
            if (treeParent[node] >= 0 && !terminal[node] && childCount[node] == 0) {
                stack[top++] = node;
            }
        }
        while (top > 0) {
            int leaf = stack[--top];
            int up = treeParent[leaf];
            treeParent[leaf] = -1;
            if (--childCount[up] == 0 && !terminal[up]) {
                stack[top++] = up;
            }
        }
    }

    private SteinerTree toSteinerTree(int root, int[] treeParent) {
        int n = treeParent.length;
        IntRBTreeSet servers = new IntRBTreeSet();
        List<SteinerTree.ServerLink> links = new ArrayList<>();
        for (int node = 0; node < n; node++) {
            if (treeParent[node] < 0) {
                continue;
            }
            servers.add(network.serverIndex().toExternal(node));
            if (node != root) {
                links.add(new SteinerTree.ServerLink(
                        network.serverIndex().toExternal(treeParent[node]),
                        network.serverIndex().toExternal(node)
                ));
            }
        }
        return new SteinerTree(servers.toIntArray(), links);
    }

    private static long linkKey(int a, int b) {
        return ((long) Math.min(a, b) << 32) | (Math.max(a, b) & 0xFFFFFFFFL);
    }
}
