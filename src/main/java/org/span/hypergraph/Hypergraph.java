package org.span.hypergraph;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.IntUnaryOperator;

/**
 * Weighted hypergraph of anchor and dependent vertices.
 * <p>
 * Incident-hyperedge lists and neighbourhoods are maintained eagerly because the
 * placement engine queries them on every gain evaluation. Vertices are never
 * removed; hyperedges are only replaced wholesale through
 * {@link #mergeHyperedges(List)}, {@link #splitHyperedge(Hyperedge, List)},
 * {@link #addHyperedge(Hyperedge)} and {@link #removeHyperedge(Hyperedge)}.
 * <p>
 * Invariant: every hyperedge contains exactly one anchor vertex.
 * <p>
 * This class is NOT thread-safe.
 */
public final class Hypergraph {

    private final IntArrayList vertexList = new IntArrayList();
    private final Int2ObjectOpenHashMap<VertexRole> roles = new Int2ObjectOpenHashMap<>();
    private final List<Hyperedge> hyperedgeList = new ArrayList<>();
    private final Set<Hyperedge> hyperedgeSet = new HashSet<>();
    private final Int2ObjectOpenHashMap<List<Hyperedge>> incident = new Int2ObjectOpenHashMap<>();
    // neighbour -> number of hyperedges shared with the keyed vertex
    private final Int2ObjectOpenHashMap<Int2IntOpenHashMap> neighbourCounts = new Int2ObjectOpenHashMap<>();

    // ========================================================================
    // CONSTRUCTION
    // ========================================================================

    /**
     * Adds a vertex. Adding an existing vertex with the same role is a no-op.
     *
     * @throws IllegalArgumentException for negative ids or a conflicting role.
     */
    public Hypergraph addVertex(int vertex, VertexRole role) {
        Objects.requireNonNull(role, "role");
        if (vertex < 0) {
            throw new IllegalArgumentException("Vertex ids must be >= 0, got " + vertex);
        }
        VertexRole existing = roles.get(vertex);
        if (existing != null) {
            if (existing != role) {
                throw new IllegalArgumentException("Vertex " + vertex + " already added as " + existing);
            }
            return this;
        }
        vertexList.add(vertex);
        roles.put(vertex, role);
        incident.put(vertex, new ArrayList<>());
        neighbourCounts.put(vertex, new Int2IntOpenHashMap());
        return this;
    }

    /**
     * Returns an independent copy with the same vertices, roles and hyperedge order.
     */
    public Hypergraph copy() {
        Hypergraph copy = new Hypergraph();
        for (int i = 0; i < vertexList.size(); i++) {
            int vertex = vertexList.getInt(i);
            copy.addVertex(vertex, roles.get(vertex));
        }
        for (Hyperedge hyperedge : hyperedgeList) {
            copy.addHyperedge(hyperedge);
        }
        return copy;
    }

    public Hypergraph addAnchor(int vertex) {
        return addVertex(vertex, VertexRole.ANCHOR);
    }

    public Hypergraph addDependent(int vertex) {
        return addVertex(vertex, VertexRole.DEPENDENT);
    }

    /**
     * Appends a hyperedge.
     *
     * @throws IllegalArgumentException if a vertex is unknown, the anchor count is not
     *                                  exactly one, or the hyperedge is already present.
     */
    public Hypergraph addHyperedge(Hyperedge hyperedge) {
        insertHyperedge(hyperedgeList.size(), hyperedge);
        return this;
    }

    /**
     * Removes a hyperedge and updates neighbourhoods.
     *
     * @throws IllegalArgumentException if the hyperedge is not in this hypergraph.
     */
    public void removeHyperedge(Hyperedge hyperedge) {
        if (!hyperedgeSet.contains(hyperedge)) {
            throw new IllegalArgumentException("The hyperedge " + hyperedge + " is not in this hypergraph");
        }
        hyperedgeList.remove(hyperedge);
        hyperedgeSet.remove(hyperedge);
        for (int i = 0; i < hyperedge.vertexCount(); i++) {
            int vertex = hyperedge.vertexAt(i);
            incident.get(vertex).remove(hyperedge);
            Int2IntOpenHashMap counts = neighbourCounts.get(vertex);
            for (int j = 0; j < hyperedge.vertexCount(); j++) {
                int other = hyperedge.vertexAt(j);
                if (other != vertex && counts.addTo(other, -1) == 1) {
                    counts.remove(other);
                }
            }
        }
    }

    // ========================================================================
    // STRUCTURAL EDITS
    // ========================================================================

    /**
     * Replaces the given hyperedges by their union.
     * <p>
     * The merged hyperedge takes the lowest list position among the inputs. The edit is
     * atomic: every contract is checked before the hypergraph is touched.
     *
     * @param toMerge hyperedges of this hypergraph, unique, with equal weights.
     * @return the merged hyperedge.
     */
    public Hyperedge mergeHyperedges(List<Hyperedge> toMerge) {
        Objects.requireNonNull(toMerge, "toMerge");
        for (Hyperedge hyperedge : toMerge) {
            if (!hyperedgeSet.contains(hyperedge)) {
                throw new IllegalArgumentException(
                        "At least one hyperedge in the merge list does not belong to this hypergraph: " + hyperedge
                );
            }
        }
        if (new HashSet<>(toMerge).size() != toMerge.size()) {
            throw new IllegalArgumentException("The hyperedges to be merged must be unique");
        }
        Hyperedge merged = Hyperedge.union(toMerge);
        requireSingleAnchor(merged);
        if (hyperedgeSet.contains(merged) && !toMerge.contains(merged)) {
            throw new IllegalArgumentException("Merged hyperedge " + merged + " already exists");
        }

        int position = Integer.MAX_VALUE;
        for (Hyperedge hyperedge : toMerge) {
            position = Math.min(position, hyperedgeList.indexOf(hyperedge));
        }
        for (Hyperedge hyperedge : toMerge) {
            removeHyperedge(hyperedge);
        }
        insertHyperedge(position, merged);
        return merged;
    }

    /**
     * Replaces {@code old} with {@code parts}, which take its list position in order.
     *
     * @param old hyperedge of this hypergraph.
     * @param parts non-empty list whose vertex union equals the vertices of {@code old};
     *              each part must contain the anchor of {@code old}.
     */
    public void splitHyperedge(Hyperedge old, List<Hyperedge> parts) {
        Objects.requireNonNull(old, "old");
        Objects.requireNonNull(parts, "parts");
        if (!hyperedgeSet.contains(old)) {
            throw new IllegalArgumentException("The hyperedge " + old + " is not in this hypergraph");
        }
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("A hyperedge must be split into at least one part");
        }
        if (new HashSet<>(parts).size() != parts.size()) {
            throw new IllegalArgumentException("The split parts must be unique");
        }
        int[] covered = Hyperedge.union(withUnitWeight(parts)).vertices();
        if (!Arrays.equals(covered, old.vertices())) {
            throw new IllegalArgumentException(parts + " does not match the vertices in " + old);
        }
        for (Hyperedge part : parts) {
            requireSingleAnchor(part);
            if (hyperedgeSet.contains(part) && !part.equals(old)) {
                throw new IllegalArgumentException("Split part " + part + " already exists");
            }
        }

        int position = hyperedgeList.indexOf(old);
        removeHyperedge(old);
        for (int i = 0; i < parts.size(); i++) {
            insertHyperedge(position + i, parts.get(i));
        }
    }

    // ========================================================================
    // QUERIES
    // ========================================================================

    /**
     * Returns all vertices in ascending order.
     */
    public int[] vertices() {
        int[] sorted = vertexList.toIntArray();
        Arrays.sort(sorted);
        return sorted;
    }

    public int vertexCount() {
        return vertexList.size();
    }

    public boolean containsVertex(int vertex) {
        return roles.containsKey(vertex);
    }

    public boolean isAnchor(int vertex) {
        return requireRole(vertex) == VertexRole.ANCHOR;
    }

    public VertexRole role(int vertex) {
        return requireRole(vertex);
    }

    /**
     * Returns all anchor vertices in ascending order.
     */
    public int[] anchorVertices() {
        IntArrayList anchors = new IntArrayList();
        for (int vertex : vertices()) {
            if (roles.get(vertex) == VertexRole.ANCHOR) {
                anchors.add(vertex);
            }
        }
        return anchors.toIntArray();
    }

    public int anchorCount() {
        int count = 0;
        for (VertexRole role : roles.values()) {
            if (role == VertexRole.ANCHOR) {
                count++;
            }
        }
        return count;
    }

    /**
     * Returns the unique anchor vertex of a hyperedge.
     */
    public int anchorOf(Hyperedge hyperedge) {
        for (int i = 0; i < hyperedge.vertexCount(); i++) {
            int vertex = hyperedge.vertexAt(i);
            if (isAnchor(vertex)) {
                return vertex;
            }
        }
        throw new IllegalStateException("Hyperedge " + hyperedge + " has no anchor vertex");
    }

    /**
     * Returns an unmodifiable view of the hyperedges in list order.
     */
    public List<Hyperedge> hyperedges() {
        return Collections.unmodifiableList(hyperedgeList);
    }

    public int hyperedgeCount() {
        return hyperedgeList.size();
    }

    public boolean containsHyperedge(Hyperedge hyperedge) {
        return hyperedgeSet.contains(hyperedge);
    }

    /**
     * Returns an unmodifiable view of the hyperedges incident to {@code vertex}.
     */
    public List<Hyperedge> incidentHyperedges(int vertex) {
        requireRole(vertex);
        return Collections.unmodifiableList(incident.get(vertex));
    }

    /**
     * Returns the vertices sharing at least one hyperedge with {@code vertex}, ascending.
     */
    public int[] neighbours(int vertex) {
        requireRole(vertex);
        int[] result = neighbourCounts.get(vertex).keySet().toIntArray();
        Arrays.sort(result);
        return result;
    }

    /**
     * Checks that a placement covers exactly the vertices of this hypergraph.
     *
     * @param placedVertices vertices the placement assigns, in any order.
     */
    public boolean isPlacement(int[] placedVertices) {
        if (placedVertices.length != vertexList.size()) {
            return false;
        }
        for (int vertex : placedVertices) {
            if (!roles.containsKey(vertex)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Finds the boundary (frontier) of a placement: vertices with at least one
     * neighbour placed on a different server.
     *
     * @param serverOf current server of each vertex.
     * @return boundary vertices in ascending order.
     */
    public int[] boundary(IntUnaryOperator serverOf) {
        IntArrayList boundary = new IntArrayList();
        for (int vertex : vertices()) {
            int server = serverOf.applyAsInt(vertex);
            for (int neighbour : neighbourCounts.get(vertex).keySet()) {
                if (serverOf.applyAsInt(neighbour) != server) {
                    boundary.add(vertex);
                    break;
                }
            }
        }
        return boundary.toIntArray();
    }

    @Override
    public String toString() {
        return "Hypergraph[vertices=" + vertexList.size() + ", hyperedges=" + hyperedgeList.size() + "]";
    }

    // ========================================================================
    // INTERNALS
    // ========================================================================

    private void insertHyperedge(int position, Hyperedge hyperedge) {
        Objects.requireNonNull(hyperedge, "hyperedge");
        for (int i = 0; i < hyperedge.vertexCount(); i++) {
            int vertex = hyperedge.vertexAt(i);
            if (!roles.containsKey(vertex)) {
                throw new IllegalArgumentException(
                        "An element of the hyperedge " + hyperedge + " is not a vertex; add it first"
                );
            }
        }
        requireSingleAnchor(hyperedge);
        if (hyperedgeSet.contains(hyperedge)) {
            throw new IllegalArgumentException("The hyperedge " + hyperedge + " is already in this hypergraph");
        }

        hyperedgeList.add(position, hyperedge);
        hyperedgeSet.add(hyperedge);
        for (int i = 0; i < hyperedge.vertexCount(); i++) {
            int vertex = hyperedge.vertexAt(i);
            incident.get(vertex).add(hyperedge);
            Int2IntOpenHashMap counts = neighbourCounts.get(vertex);
            for (int j = 0; j < hyperedge.vertexCount(); j++) {
                int other = hyperedge.vertexAt(j);
                if (other != vertex) {
                    counts.addTo(other, 1);
                }
            }
        }
    }

    private void requireSingleAnchor(Hyperedge hyperedge) {
        int anchors = 0;
        for (int i = 0; i < hyperedge.vertexCount(); i++) {
            if (isAnchor(hyperedge.vertexAt(i))) {
                anchors++;
            }
        }
        if (anchors != 1) {
            throw new IllegalArgumentException(
                    "Hyperedge " + hyperedge + " must contain exactly one anchor vertex, found " + anchors
            );
        }
    }

    private VertexRole requireRole(int vertex) {
        VertexRole role = roles.get(vertex);
        if (role == null) {
            throw new IllegalArgumentException("Vertex " + vertex + " is not in this hypergraph");
        }
        return role;
    }

    private static List<Hyperedge> withUnitWeight(List<Hyperedge> parts) {
        List<Hyperedge> normalized = new ArrayList<>(parts.size());
        for (Hyperedge part : parts) {
            normalized.add(Hyperedge.of(part.vertices()));
        }
        return normalized;
    }
}
