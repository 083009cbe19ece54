package org.span.network;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Tree connecting a set of servers in a {@link ServerNetwork}.
 * <p>
 * Servers include every terminal plus any intermediate server the tree passes through.
 * Links are undirected; {@link #directedFrom(int)} orients them away from a chosen origin.
 */
public final class SteinerTree {

    /**
     * One tree link, oriented parent to child when it comes out of {@link #directedFrom(int)}.
     */
    public record ServerLink(int from, int to) {
    }

    private final int[] servers;
    private final List<ServerLink> links;

    SteinerTree(int[] sortedServers, List<ServerLink> links) {
        this.servers = sortedServers;
        this.links = Collections.unmodifiableList(links);
    }

    /**
     * Returns server ids in the tree in ascending order.
     */
    public int[] servers() {
        return servers.clone();
    }

    public boolean containsServer(int serverId) {
        return Arrays.binarySearch(servers, serverId) >= 0;
    }

    public List<ServerLink> links() {
        return links;
    }

    public int edgeCount() {
        return links.size();
    }

    /**
     * Orients the tree away from {@code origin}.
     * <p>
     * Links leaving the origin come first in ascending neighbour order, then each
     * neighbour's subtree is emitted the same way.
     *
     * @throws IllegalArgumentException when the origin is not a server of this tree.
     */
    public List<ServerLink> directedFrom(int origin) {
        if (!containsServer(origin)) {
            throw new IllegalArgumentException("Server " + origin + " is not part of this tree");
        }
        Int2ObjectOpenHashMap<IntArrayList> adjacency = new Int2ObjectOpenHashMap<>();
        for (ServerLink link : links) {
            adjacency.computeIfAbsent(link.from(), k -> new IntArrayList()).add(link.to());
            adjacency.computeIfAbsent(link.to(), k -> new IntArrayList()).add(link.from());
        }
        for (IntArrayList neighbours : adjacency.values()) {
            neighbours.sort(null);
        }
        List<ServerLink> directed = new ArrayList<>(links.size());
        emitFrom(origin, Integer.MIN_VALUE, adjacency, directed);
        return directed;
    }

    private static void emitFrom(int node, int cameFrom, Int2ObjectOpenHashMap<IntArrayList> adjacency,
                                 List<ServerLink> out) {
        IntArrayList neighbours = adjacency.get(node);
        if (neighbours == null) {
            return;
        }
        for (int i = 0; i < neighbours.size(); i++) {
            int next = neighbours.getInt(i);
            if (next != cameFrom) {
                out.add(new ServerLink(node, next));
            }
        }
        for (int i = 0; i < neighbours.size(); i++) {
            int next = neighbours.getInt(i);
            if (next != cameFrom) {
                emitFrom(next, node, adjacency, out);
            }
        }
    }

    @Override
    public String toString() {
        return "SteinerTree[servers=" + Arrays.toString(servers) + ", links=" + links + "]";
    }
}
