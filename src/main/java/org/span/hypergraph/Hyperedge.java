package org.span.hypergraph;

import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import lombok.EqualsAndHashCode;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable weighted hyperedge.
 * <p>
 * Vertices are stored in ascending order without duplicates. Equality and hash are
 * defined by vertex set and weight, so a hyperedge keeps its identity across
 * structural edits of the hypergraph that owns it.
 */
@EqualsAndHashCode
public final class Hyperedge {
    private final int[] vertices;
    private final int weight;

    private Hyperedge(int[] sortedVertices, int weight) {
        this.vertices = sortedVertices;
        this.weight = weight;
    }

    /**
     * Creates a weight-1 hyperedge.
     */
    public static Hyperedge of(int... vertices) {
        return weighted(1, vertices);
    }

    /**
     * Creates a hyperedge with explicit weight.
     *
     * @param weight number of communication events the hyperedge requires, {@code >= 1}.
     * @param vertices member vertices in any order.
     * @throws IllegalArgumentException when vertices are empty or duplicated, or weight is not positive.
     */
    public static Hyperedge weighted(int weight, int... vertices) {
        Objects.requireNonNull(vertices, "vertices");
        if (vertices.length == 0) {
            throw new IllegalArgumentException("Hyperedges must contain at least 1 vertex");
        }
        if (weight < 1) {
            throw new IllegalArgumentException("Hyperedge weight must be >= 1, got " + weight);
        }
        int[] sorted = vertices.clone();
        Arrays.sort(sorted);
        for (int i = 1; i < sorted.length; i++) {
            if (sorted[i] == sorted[i - 1]) {
                throw new IllegalArgumentException("Duplicate vertex " + sorted[i] + " in hyperedge");
            }
        }
        return new Hyperedge(sorted, weight);
    }

    /**
     * Builds the hyperedge spanning the union of all given hyperedges.
     * <p>
     * Does not touch any hypergraph; callers use it to price a merge before
     * committing it.
     *
     * @throws IllegalArgumentException when the list is empty or weights differ.
     */
    public static Hyperedge union(List<Hyperedge> hyperedges) {
        Objects.requireNonNull(hyperedges, "hyperedges");
        if (hyperedges.isEmpty()) {
            throw new IllegalArgumentException("At least one hyperedge is required");
        }
        int weight = hyperedges.get(0).weight;
        IntRBTreeSet members = new IntRBTreeSet();
        for (Hyperedge hyperedge : hyperedges) {
            if (hyperedge.weight != weight) {
                throw new IllegalArgumentException("Weights of hyperedges to merge should be equal");
            }
            for (int vertex : hyperedge.vertices) {
                members.add(vertex);
            }
        }
        return new Hyperedge(members.toIntArray(), weight);
    }

    public int weight() {
        return weight;
    }

    public int vertexCount() {
        return vertices.length;
    }

    public int vertexAt(int position) {
        return vertices[position];
    }

    /**
     * Returns a copy of the member vertices in ascending order.
     */
    public int[] vertices() {
        return vertices.clone();
    }

    public boolean contains(int vertex) {
        return Arrays.binarySearch(vertices, vertex) >= 0;
    }

    @Override
    public String toString() {
        return "Hyperedge" + Arrays.toString(vertices) + (weight == 1 ? "" : "x" + weight);
    }
}
