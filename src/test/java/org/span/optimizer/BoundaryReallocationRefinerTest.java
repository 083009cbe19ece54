package org.span.optimizer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.span.hypergraph.Hyperedge;
import org.span.hypergraph.Hypergraph;
import org.span.network.ServerNetwork;
import org.span.network.ServerNetworks;
import org.span.placement.Distribution;
import org.span.placement.Placement;
import org.span.testutil.PlacementFixtures;

import java.util.SplittableRandom;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BoundaryReallocationRefiner Tests")
class BoundaryReallocationRefinerTest {

    @ParameterizedTest
    @CsvSource({"1, 0.0", "5, 0.05", "50, 0.0", "1000, 0.05", "10, 1.0"})
    @DisplayName("Refinement keeps capacity and never increases cost")
    void testCapacityAndMonotoneCost(int numRounds, double stopParameter) {
        for (long seed = 1; seed <= 4; seed++) {
            SplittableRandom random = new SplittableRandom(seed);
            Hypergraph hypergraph = PlacementFixtures.randomHypergraph(10, 20, 18, 3, random);
            ServerNetwork network = ServerNetworks.randomConnected(5, 12, 0.3d, random);
            OptimizerState state = OptimizerState.create(
                    PlacementFixtures.randomDistribution(hypergraph, network, random), 5);
            long before = state.totalCost();

            new BoundaryReallocationRefiner(numRounds, stopParameter, true, true).refine(state, random);

            assertTrue(state.isCapacityRespected());
            assertTrue(state.totalCost() <= before);
            assertEquals(state.recomputeTotalCost(), state.totalCost());
        }
    }

    @Test
    @DisplayName("A dependent joins the server holding the rest of its hyperedge")
    void testPullsDependentTogether() {
        Hypergraph hypergraph = PlacementFixtures.vertices(1, 2);
        hypergraph.addHyperedge(Hyperedge.of(0, 1, 2));
        OptimizerState state = OptimizerState.create(new Distribution(
                hypergraph, PlacementFixtures.placement(0, 0, 1, 0, 2, 1), PlacementFixtures.twoServers(1)), 5);

        boolean refined = new BoundaryReallocationRefiner(10, 0.0d, false, false).refine(state, new SplittableRandom(1));

        assertTrue(refined);
        assertEquals(0, state.currentServer(2));
        assertEquals(0L, state.totalCost());
    }

    @Test
    @DisplayName("Crossed hyperedges on full servers are untangled")
    void testSwap() {
        // 0's hyperedge lives on server 1, 1's hyperedge lives on server 0; both servers are full
        Hypergraph hypergraph = PlacementFixtures.vertices(2, 2);
        hypergraph.addHyperedge(Hyperedge.weighted(2, 0, 2)).addHyperedge(Hyperedge.weighted(2, 1, 3));
        OptimizerState state = OptimizerState.create(new Distribution(
                hypergraph,
                PlacementFixtures.placement(0, 0, 1, 1, 2, 1, 3, 0),
                PlacementFixtures.twoServers(1)), 5);
        assertEquals(4L, state.totalCost());

        new BoundaryReallocationRefiner(10, 0.0d, true, true).refine(state, new SplittableRandom(3));

        assertEquals(0L, state.totalCost());
        assertTrue(state.isCapacityRespected());
    }

    @Test
    @DisplayName("Zero rounds change nothing")
    void testZeroRounds() {
        SplittableRandom random = new SplittableRandom(2);
        Hypergraph hypergraph = PlacementFixtures.randomHypergraph(5, 10, 8, 3, random);
        Distribution distribution = PlacementFixtures.randomDistribution(
                hypergraph, ServerNetworks.complete(3, 3), random);
        OptimizerState state = OptimizerState.create(distribution, 5);

        assertFalse(new BoundaryReallocationRefiner(0, 0.0d, true, true).refine(state, random));
        assertEquals(distribution.placement(), state.toDistribution().placement());
    }

    @ParameterizedTest
    @CsvSource({"0, true", "10, true", "10, false"})
    @DisplayName("Over-capacity input leaves the refiner as a valid placement")
    void testRepairsCapacity(int numRounds, boolean reallocateAnchors) {
        // anchors 0, 1, 2 share server 0 although it holds two
        Hypergraph hypergraph = PlacementFixtures.vertices(3, 2);
        hypergraph.addHyperedge(Hyperedge.of(0, 3, 4))
                .addHyperedge(Hyperedge.of(1, 3))
                .addHyperedge(Hyperedge.of(2, 4));
        Placement crowded = PlacementFixtures.placement(0, 0, 1, 0, 2, 0, 3, 0, 4, 1);
        OptimizerState state = OptimizerState.create(
                new Distribution(hypergraph, crowded, PlacementFixtures.twoServers(2)), 5);
        assertFalse(state.isCapacityRespected());

        boolean refined = new BoundaryReallocationRefiner(numRounds, 0.0d, true, reallocateAnchors)
                .refine(state, new SplittableRandom(5));

        assertTrue(refined);
        assertTrue(state.isCapacityRespected());
        assertTrue(state.toDistribution().isValid());
        assertEquals(state.recomputeTotalCost(), state.totalCost());
    }

    @Test
    @DisplayName("Anchors stay put when reallocation of anchors is disabled")
    void testAnchorsPinned() {
        SplittableRandom random = new SplittableRandom(4);
        Hypergraph hypergraph = PlacementFixtures.randomHypergraph(6, 12, 10, 3, random);
        OptimizerState state = OptimizerState.create(PlacementFixtures.randomDistribution(
                hypergraph, ServerNetworks.randomConnected(4, 8, 0.5d, random), random), 5);
        int[] anchors = hypergraph.anchorVertices();
        int[] servers = new int[anchors.length];
        for (int i = 0; i < anchors.length; i++) {
            servers[i] = state.currentServer(anchors[i]);
        }

        new BoundaryReallocationRefiner(20, 0.0d, true, false).refine(state, random);

        for (int i = 0; i < anchors.length; i++) {
            assertEquals(servers[i], state.currentServer(anchors[i]));
        }
    }

    @Test
    @DisplayName("Exception Path: locked state and invalid parameters")
    void testInvalid() {
        Hypergraph hypergraph = PlacementFixtures.vertices(1, 1);
        Hyperedge hyperedge = Hyperedge.of(0, 1);
        hypergraph.addHyperedge(hyperedge);
        OptimizerState state = OptimizerState.create(new Distribution(
                hypergraph, PlacementFixtures.placement(0, 0, 1, 1), PlacementFixtures.twoServers(1)), 5);
        state.commitEmbedding(hyperedge);

        BoundaryReallocationRefiner refiner = new BoundaryReallocationRefiner(1, 0.0d, true, true);
        OptimizerException ex = assertThrows(OptimizerException.class,
                () -> refiner.refine(state, new SplittableRandom(1)));
        assertEquals(OptimizerException.REASON_PLACEMENT_LOCKED, ex.getReasonCode());

        assertThrows(IllegalArgumentException.class, () -> new BoundaryReallocationRefiner(-1, 0.0d, true, true));
        assertThrows(IllegalArgumentException.class, () -> new BoundaryReallocationRefiner(1, 1.5d, true, true));
    }
}
