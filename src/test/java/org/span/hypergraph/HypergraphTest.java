package org.span.hypergraph;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Hypergraph Tests")
class HypergraphTest {

    private Hypergraph hypergraph;

    @BeforeEach
    void setUp() {
        // anchors 0, 1; dependents 2..5
        hypergraph = new Hypergraph()
                .addAnchor(0)
                .addAnchor(1)
                .addDependent(2)
                .addDependent(3)
                .addDependent(4)
                .addDependent(5);
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Vertices and roles are queryable")
        void testVertices() {
            assertArrayEquals(new int[]{0, 1, 2, 3, 4, 5}, hypergraph.vertices());
            assertArrayEquals(new int[]{0, 1}, hypergraph.anchorVertices());
            assertEquals(2, hypergraph.anchorCount());
            assertTrue(hypergraph.isAnchor(0));
            assertFalse(hypergraph.isAnchor(2));
            assertEquals(VertexRole.DEPENDENT, hypergraph.role(3));
        }

        @Test
        @DisplayName("Re-adding a vertex with the same role is a no-op, a different role fails")
        void testRoleConflict() {
            hypergraph.addAnchor(0);
            assertEquals(6, hypergraph.vertexCount());
            assertThrows(IllegalArgumentException.class, () -> hypergraph.addDependent(0));
            assertThrows(IllegalArgumentException.class, () -> hypergraph.addAnchor(-1));
        }

        @Test
        @DisplayName("Exception Path: hyperedges need exactly one anchor and known vertices")
        void testHyperedgeContracts() {
            assertThrows(IllegalArgumentException.class, () -> hypergraph.addHyperedge(Hyperedge.of(0, 1, 2)));
            assertThrows(IllegalArgumentException.class, () -> hypergraph.addHyperedge(Hyperedge.of(2, 3)));
            assertThrows(IllegalArgumentException.class, () -> hypergraph.addHyperedge(Hyperedge.of(0, 9)));
            assertEquals(0, hypergraph.hyperedgeCount());
        }

        @Test
        @DisplayName("Copies keep vertices, roles and hyperedge order but evolve independently")
        void testCopy() {
            hypergraph.addHyperedge(Hyperedge.of(1, 4)).addHyperedge(Hyperedge.of(0, 2, 3));

            Hypergraph copy = hypergraph.copy();
            assertArrayEquals(hypergraph.vertices(), copy.vertices());
            assertArrayEquals(new int[]{0, 1}, copy.anchorVertices());
            assertEquals(List.of(Hyperedge.of(1, 4), Hyperedge.of(0, 2, 3)), copy.hyperedges());
            assertArrayEquals(hypergraph.neighbours(2), copy.neighbours(2));

            copy.addHyperedge(Hyperedge.of(0, 5));
            copy.removeHyperedge(Hyperedge.of(1, 4));
            assertEquals(2, hypergraph.hyperedgeCount());
            assertTrue(hypergraph.containsHyperedge(Hyperedge.of(1, 4)));
            assertFalse(hypergraph.containsHyperedge(Hyperedge.of(0, 5)));
        }

        @Test
        @DisplayName("Exception Path: duplicate hyperedges are rejected")
        void testDuplicateHyperedge() {
            hypergraph.addHyperedge(Hyperedge.of(0, 2));
            assertThrows(IllegalArgumentException.class, () -> hypergraph.addHyperedge(Hyperedge.of(2, 0)));
        }

        @Test
        @DisplayName("anchorOf returns the single anchor")
        void testAnchorOf() {
            Hyperedge hyperedge = Hyperedge.of(1, 3, 4);
            hypergraph.addHyperedge(hyperedge);
            assertEquals(1, hypergraph.anchorOf(hyperedge));
        }
    }

    @Nested
    @DisplayName("Adjacency")
    class Adjacency {

        @Test
        @DisplayName("Neighbours and incident hyperedges follow add and remove")
        void testNeighbours() {
            Hyperedge first = Hyperedge.of(0, 2, 3);
            Hyperedge second = Hyperedge.of(0, 3, 4);
            hypergraph.addHyperedge(first).addHyperedge(second);

            assertArrayEquals(new int[]{2, 3, 4}, hypergraph.neighbours(0));
            assertArrayEquals(new int[]{0, 2, 4}, hypergraph.neighbours(3));
            assertEquals(List.of(first, second), hypergraph.incidentHyperedges(3));

            hypergraph.removeHyperedge(second);
            assertArrayEquals(new int[]{2, 3}, hypergraph.neighbours(0));
            assertArrayEquals(new int[]{}, hypergraph.neighbours(4));
            assertEquals(List.of(first), hypergraph.incidentHyperedges(3));
        }

        @Test
        @DisplayName("Shared neighbours survive removal of one of two hyperedges")
        void testNeighbourMultiplicity() {
            hypergraph.addHyperedge(Hyperedge.of(0, 2)).addHyperedge(Hyperedge.of(0, 2, 3));
            hypergraph.removeHyperedge(Hyperedge.of(0, 2, 3));

            assertArrayEquals(new int[]{2}, hypergraph.neighbours(0));
        }

        @Test
        @DisplayName("Exception Path: removing an unknown hyperedge")
        void testRemoveUnknown() {
            assertThrows(IllegalArgumentException.class, () -> hypergraph.removeHyperedge(Hyperedge.of(0, 2)));
        }

        @Test
        @DisplayName("Boundary contains vertices with a neighbour on another server")
        void testBoundary() {
            hypergraph.addHyperedge(Hyperedge.of(0, 2, 3)).addHyperedge(Hyperedge.of(1, 4, 5));
            // 0,2 on server 10; 3 on 11; 1,4,5 all on 11
            int[] servers = {10, 11, 10, 11, 11, 11};

            assertArrayEquals(new int[]{0, 2, 3}, hypergraph.boundary(v -> servers[v]));
        }

        @Test
        @DisplayName("isPlacement requires exactly the hypergraph's vertices")
        void testIsPlacement() {
            assertTrue(hypergraph.isPlacement(new int[]{5, 4, 3, 2, 1, 0}));
            assertFalse(hypergraph.isPlacement(new int[]{0, 1, 2, 3, 4}));
            assertFalse(hypergraph.isPlacement(new int[]{0, 1, 2, 3, 4, 9}));
        }
    }

    @Nested
    @DisplayName("Structural edits")
    class StructuralEdits {

        @Test
        @DisplayName("Merge replaces inputs at the lowest position")
        void testMerge() {
            Hyperedge a = Hyperedge.of(1, 5);
            Hyperedge b = Hyperedge.of(0, 2);
            Hyperedge c = Hyperedge.of(0, 3);
            hypergraph.addHyperedge(a).addHyperedge(b).addHyperedge(c);

            Hyperedge merged = hypergraph.mergeHyperedges(List.of(c, b));

            assertEquals(Hyperedge.of(0, 2, 3), merged);
            assertEquals(List.of(a, merged), hypergraph.hyperedges());
            assertEquals(List.of(merged), hypergraph.incidentHyperedges(2));
            assertArrayEquals(new int[]{2, 3}, hypergraph.neighbours(0));
        }

        @Test
        @DisplayName("Exception Path: merge inputs must exist, be unique, share weight and one anchor")
        void testMergeContracts() {
            Hyperedge a = Hyperedge.of(0, 2);
            Hyperedge b = Hyperedge.of(1, 3);
            Hyperedge heavy = Hyperedge.weighted(2, 0, 4);
            hypergraph.addHyperedge(a).addHyperedge(b).addHyperedge(heavy);

            assertThrows(IllegalArgumentException.class, () -> hypergraph.mergeHyperedges(List.of(a, b)));
            assertThrows(IllegalArgumentException.class, () -> hypergraph.mergeHyperedges(List.of(a, heavy)));
            assertThrows(IllegalArgumentException.class, () -> hypergraph.mergeHyperedges(List.of(a, a)));
            assertThrows(IllegalArgumentException.class,
                    () -> hypergraph.mergeHyperedges(List.of(a, Hyperedge.of(0, 5))));
            assertEquals(List.of(a, b, heavy), hypergraph.hyperedges());
        }

        @Test
        @DisplayName("Split inserts parts at the old position, in order")
        void testSplit() {
            Hyperedge first = Hyperedge.of(1, 5);
            Hyperedge old = Hyperedge.of(0, 2, 3, 4);
            Hyperedge last = Hyperedge.of(1, 4);
            hypergraph.addHyperedge(first).addHyperedge(old).addHyperedge(last);

            Hyperedge p1 = Hyperedge.of(0, 2);
            Hyperedge p2 = Hyperedge.of(0, 3, 4);
            hypergraph.splitHyperedge(old, List.of(p1, p2));

            assertEquals(List.of(first, p1, p2, last), hypergraph.hyperedges());
            assertFalse(hypergraph.containsHyperedge(old));
            assertArrayEquals(new int[]{2, 3, 4}, hypergraph.neighbours(0));
            assertArrayEquals(new int[]{0}, hypergraph.neighbours(2));
        }

        @Test
        @DisplayName("Exception Path: split parts must cover the old vertices and each hold the anchor")
        void testSplitContracts() {
            Hyperedge old = Hyperedge.of(0, 2, 3);
            hypergraph.addHyperedge(old);

            assertThrows(IllegalArgumentException.class,
                    () -> hypergraph.splitHyperedge(old, List.of(Hyperedge.of(0, 2))));
            assertThrows(IllegalArgumentException.class,
                    () -> hypergraph.splitHyperedge(old, List.of(Hyperedge.of(0, 2), Hyperedge.of(3))));
            assertThrows(IllegalArgumentException.class,
                    () -> hypergraph.splitHyperedge(old, List.of()));
            assertEquals(List.of(old), hypergraph.hyperedges());
        }

        @Test
        @DisplayName("Merge then split restores the original hyperedges")
        void testMergeSplitRoundTrip() {
            Hyperedge a = Hyperedge.of(0, 2);
            Hyperedge b = Hyperedge.of(0, 3);
            hypergraph.addHyperedge(a).addHyperedge(b);

            Hyperedge merged = hypergraph.mergeHyperedges(List.of(a, b));
            hypergraph.splitHyperedge(merged, List.of(a, b));

            assertEquals(List.of(a, b), hypergraph.hyperedges());
            assertArrayEquals(new int[]{2, 3}, hypergraph.neighbours(0));
            assertArrayEquals(new int[]{0}, hypergraph.neighbours(2));
        }
    }
}
