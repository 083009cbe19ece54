package org.span.placement;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.Arrays;

/**
 * Mutable assignment of hypergraph vertices to server ids.
 * <p>
 * A placement knows nothing about the hypergraph or network it refers to;
 * totality and capacity are checked by {@link Distribution}.
 */
public final class Placement {
    private static final int UNPLACED = Integer.MIN_VALUE;

    private final Int2IntOpenHashMap serverByVertex;

    public Placement() {
        this.serverByVertex = new Int2IntOpenHashMap();
        this.serverByVertex.defaultReturnValue(UNPLACED);
    }

    private Placement(Int2IntOpenHashMap serverByVertex) {
        this.serverByVertex = serverByVertex;
        this.serverByVertex.defaultReturnValue(UNPLACED);
    }

    /**
     * Assigns (or reassigns) a vertex to a server.
     */
    public Placement place(int vertex, int serverId) {
        if (serverId == UNPLACED) {
            throw new IllegalArgumentException("Server id " + serverId + " is reserved");
        }
        serverByVertex.put(vertex, serverId);
        return this;
    }

    /**
     * @throws InvalidPlacementException with {@code PLACEMENT_UNKNOWN_VERTEX} when unplaced.
     */
    public int serverOf(int vertex) {
        int server = serverByVertex.get(vertex);
        if (server == UNPLACED) {
            throw new InvalidPlacementException(
                    InvalidPlacementException.REASON_UNKNOWN_VERTEX,
                    "Vertex " + vertex + " is not placed");
        }
        return server;
    }

    public boolean contains(int vertex) {
        return serverByVertex.containsKey(vertex);
    }

    /**
     * Returns placed vertices in ascending order.
     */
    public int[] vertices() {
        int[] vertices = serverByVertex.keySet().toIntArray();
        Arrays.sort(vertices);
        return vertices;
    }

    /**
     * Returns vertices placed on {@code serverId} in ascending order.
     */
    public int[] verticesIn(int serverId) {
        IntArrayList result = new IntArrayList();
        for (Int2IntMap.Entry entry : serverByVertex.int2IntEntrySet()) {
            if (entry.getIntValue() == serverId) {
                result.add(entry.getIntKey());
            }
        }
        int[] vertices = result.toIntArray();
        Arrays.sort(vertices);
        return vertices;
    }

    public int size() {
        return serverByVertex.size();
    }

    public Placement copy() {
        return new Placement(new Int2IntOpenHashMap(serverByVertex));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Placement)) return false;
        return serverByVertex.equals(((Placement) o).serverByVertex);
    }

    @Override
    public int hashCode() {
        return serverByVertex.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Placement{");
        int[] vertices = vertices();
        for (int i = 0; i < vertices.length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(vertices[i]).append("->").append(serverByVertex.get(vertices[i]));
        }
        return sb.append('}').toString();
    }
}
