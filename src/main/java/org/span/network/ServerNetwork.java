package org.span.network;

import it.unimi.dsi.fastutil.ints.Int2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.span.core.id.ServerIndex;

import java.util.Arrays;
import java.util.NoSuchElementException;

/**
 * Immutable, connected, undirected server network.
 * <p>
 * Layout follows the CSR (Compressed Sparse Row) convention over dense server
 * indices: {@code firstLink[index]} is the start offset of the neighbour run of
 * a server in {@code linkTarget}, neighbour runs are sorted ascending. Hop
 * distances and shortest-path parents are precomputed for every pair because
 * Steiner-tree evaluation reads them in the optimizer's hot path.
 * <p>
 * Public methods speak server ids; dense indices stay inside this package.
 */
public final class ServerNetwork {

    private final ServerIndex serverIndex;
    private final int[] capacities;

    // CSR adjacency over dense indices
    private final int[] firstLink;
    private final int[] linkTarget;

    // all-pairs hop distance and BFS parent (parent[source][node] -> predecessor on a shortest path)
    private final int[][] distance;
    private final int[][] parent;

    @Getter
    @Accessors(fluent = true)
    private final int totalCapacity;

    private final SteinerTreeSolver steinerTreeSolver;

    private ServerNetwork(ServerIndex serverIndex, int[] capacities, int[] firstLink, int[] linkTarget) {
        this.serverIndex = serverIndex;
        this.capacities = capacities;
        this.firstLink = firstLink;
        this.linkTarget = linkTarget;

        int n = capacities.length;
        this.distance = new int[n][];
        this.parent = new int[n][];
        for (int source = 0; source < n; source++) {
            bfs(source);
        }
        for (int index = 1; index < n; index++) {
            if (distance[0][index] < 0) {
                throw new IllegalArgumentException("This server network is unconnected");
            }
        }

        int total = 0;
        for (int capacity : capacities) {
            total = Math.addExact(total, capacity);
        }
        this.totalCapacity = total;
        this.steinerTreeSolver = new SteinerTreeSolver(this);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // SERVER ACCESSORS
    // ========================================================================

    public int serverCount() {
        return capacities.length;
    }

    /**
     * Returns all server ids in ascending order.
     */
    public int[] serverIds() {
        return serverIndex.externalIds();
    }

    public boolean containsServer(int serverId) {
        return serverIndex.containsExternal(serverId);
    }

    /**
     * Number of anchor vertices the server may host.
     *
     * @throws ServerIndex.UnknownServerException for unknown servers.
     */
    public int capacity(int serverId) {
        return capacities[serverIndex.toInternal(serverId)];
    }

    public ServerIndex serverIndex() {
        return serverIndex;
    }

    /**
     * Hop distance between two servers.
     */
    public int distance(int fromServerId, int toServerId) {
        return distance[serverIndex.toInternal(fromServerId)][serverIndex.toInternal(toServerId)];
    }

    /**
     * Returns neighbour server ids in ascending order.
     */
    public int[] neighbours(int serverId) {
        int index = serverIndex.toInternal(serverId);
        int start = firstLink[index];
        int end = firstLink[index + 1];
        int[] result = new int[end - start];
        for (int i = start; i < end; i++) {
            result[i - start] = serverIndex.toExternal(linkTarget[i]);
        }
        return result;
    }

    public boolean isLinked(int fromServerId, int toServerId) {
        int from = serverIndex.toInternal(fromServerId);
        int to = serverIndex.toInternal(toServerId);
        return Arrays.binarySearch(linkTarget, firstLink[from], firstLink[from + 1], to) >= 0;
    }

    /**
     * Number of undirected links.
     */
    public int linkCount() {
        return linkTarget.length / 2;
    }

    /**
     * Computes a Steiner tree over the given servers.
     *
     * @param serverIds non-empty set of server ids (duplicates allowed).
     */
    public SteinerTree steinerTree(int... serverIds) {
        if (serverIds == null || serverIds.length == 0) {
            throw new IllegalArgumentException("No servers have been provided");
        }
        int[] terminals = new int[serverIds.length];
        for (int i = 0; i < serverIds.length; i++) {
            terminals[i] = serverIndex.toInternal(serverIds[i]);
        }
        return steinerTreeSolver.solve(terminals);
    }

    // ========================================================================
    // PACKAGE CONTRACTS (dense index space)
    // ========================================================================

    int denseDistance(int from, int to) {
        return distance[from][to];
    }

    int denseParent(int source, int node) {
        return parent[source][node];
    }

    private void bfs(int source) {
        int n = capacities.length;
        int[] dist = new int[n];
        int[] pred = new int[n];
        Arrays.fill(dist, -1);
        Arrays.fill(pred, -1);
        int[] queue = new int[n];
        int head = 0;
        int tail = 0;
        dist[source] = 0;
        queue[tail++] = source;
        while (head < tail) {
            int node = queue[head++];
            for (int i = firstLink[node]; i < firstLink[node + 1]; i++) {
                int next = linkTarget[i];
                if (dist[next] < 0) {
                    dist[next] = dist[node] + 1;
                    pred[next] = node;
                    queue[tail++] = next;
                }
            }
        }
        distance[source] = dist;
        parent[source] = pred;
    }

    @Override
    public String toString() {
        return String.format("ServerNetwork[servers=%d, links=%d, totalCapacity=%d]",
                serverCount(), linkCount(), totalCapacity);
    }

    /**
     * Builder collecting servers and links before validation.
     */
    public static final class Builder {
        private final Int2IntLinkedOpenHashMap capacities = new Int2IntLinkedOpenHashMap();
        private final IntArrayList linkFrom = new IntArrayList();
        private final IntArrayList linkTo = new IntArrayList();
        private final LongOpenHashSet linkKeys = new LongOpenHashSet();

        private Builder() {
        }

        /**
         * Declares a server with a fixed capacity.
         */
        public Builder server(int serverId, int capacity) {
            if (capacity < 0) {
                throw new IllegalArgumentException("capacity must be >= 0 for server " + serverId);
            }
            if (capacities.containsKey(serverId)) {
                throw new IllegalArgumentException("Duplicate server id: " + serverId);
            }
            capacities.put(serverId, capacity);
            return this;
        }

        /**
         * Declares an undirected link. Repeated links are ignored.
         */
        public Builder link(int serverA, int serverB) {
            if (serverA == serverB) {
                throw new IllegalArgumentException("Self-link on server " + serverA);
            }
            long key = ((long) Math.min(serverA, serverB) << 32) | (Math.max(serverA, serverB) & 0xFFFFFFFFL);
            if (linkKeys.add(key)) {
                linkFrom.add(serverA);
                linkTo.add(serverB);
            }
            return this;
        }

        /**
         * Validates and freezes the network.
         *
         * @throws IllegalArgumentException when empty, when a link names an undeclared
         *                                  server, or when the network is unconnected.
         */
        public ServerNetwork build() {
            if (capacities.isEmpty()) {
                throw new IllegalArgumentException("A server network needs at least one server");
            }
            ServerIndex index = new ServerIndex(capacities.keySet().toIntArray());
            int n = index.size();
            int[] denseCapacities = new int[n];
            for (int i = 0; i < n; i++) {
                denseCapacities[i] = capacities.get(index.toExternal(i));
            }

            int[] degree = new int[n];
            int[] from = new int[linkFrom.size()];
            int[] to = new int[linkTo.size()];
            for (int i = 0; i < from.length; i++) {
                from[i] = requireDeclared(index, linkFrom.getInt(i));
                to[i] = requireDeclared(index, linkTo.getInt(i));
                degree[from[i]]++;
                degree[to[i]]++;
            }

            int[] firstLink = new int[n + 1];
            for (int i = 0; i < n; i++) {
                firstLink[i + 1] = firstLink[i] + degree[i];
            }
            int[] cursor = Arrays.copyOf(firstLink, n);
            int[] linkTarget = new int[firstLink[n]];
            for (int i = 0; i < from.length; i++) {
                linkTarget[cursor[from[i]]++] = to[i];
                linkTarget[cursor[to[i]]++] = from[i];
            }
            for (int i = 0; i < n; i++) {
                Arrays.sort(linkTarget, firstLink[i], firstLink[i + 1]);
            }
            return new ServerNetwork(index, denseCapacities, firstLink, linkTarget);
        }

        private static int requireDeclared(ServerIndex index, int serverId) {
            if (!index.containsExternal(serverId)) {
                throw new IllegalArgumentException("Link references undeclared server " + serverId);
            }
            return index.toInternal(serverId);
        }
    }

    /**
     * Zero-allocation iterator over neighbour indices of one server.
     */
    static final class NeighbourIterator {
        private final ServerNetwork network;
        private int current;
        private int end;

        NeighbourIterator(ServerNetwork network) {
            this.network = network;
        }

        NeighbourIterator resetForServer(int index) {
            this.current = network.firstLink[index];
            this.end = network.firstLink[index + 1];
            return this;
        }

        boolean hasNext() {
            return current < end;
        }

        int next() {
            if (current >= end) throw new NoSuchElementException();
            return network.linkTarget[current++];
        }
    }
}
