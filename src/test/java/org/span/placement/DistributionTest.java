package org.span.placement;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.span.hypergraph.Hyperedge;
import org.span.hypergraph.Hypergraph;
import org.span.network.ServerNetwork;
import org.span.network.ServerNetworks;
import org.span.network.SteinerTree;
import org.span.testutil.PlacementFixtures;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Distribution Tests")
class DistributionTest {

    private Hypergraph hypergraph;
    private Hyperedge first;
    private Hyperedge second;

    @BeforeEach
    void setUp() {
        // anchors 0, 1; dependents 2, 3, 4
        hypergraph = PlacementFixtures.vertices(2, 3);
        first = Hyperedge.of(0, 2, 3);
        second = Hyperedge.weighted(3, 1, 4);
        hypergraph.addHyperedge(first).addHyperedge(second);
    }

    @Test
    @DisplayName("Cost is the weighted sum of Steiner edge counts")
    void testCost() {
        ServerNetwork network = ServerNetworks.line(1, 1, 1);
        Placement placement = PlacementFixtures.placement(0, 0, 1, 2, 2, 1, 3, 2, 4, 0);
        Distribution distribution = new Distribution(hypergraph, placement, network);

        // first spans {0, 1, 2}: 2 links; second spans {2, 0}: 2 links, weight 3
        assertEquals(2, distribution.hyperedgeCost(first));
        assertEquals(6, distribution.hyperedgeCost(second));
        assertEquals(8L, distribution.cost());
        assertTrue(distribution.isValid());
    }

    @Test
    @DisplayName("Co-located hyperedges cost nothing")
    void testColocated() {
        ServerNetwork network = PlacementFixtures.twoServers(2);
        Placement placement = PlacementFixtures.placement(0, 0, 2, 0, 3, 0, 1, 1, 4, 1);
        Distribution distribution = new Distribution(hypergraph, placement, network);

        assertEquals(0L, distribution.cost());
    }

    @Test
    @DisplayName("Distribution tree is rooted at the anchor's server")
    void testDistributionTree() {
        ServerNetwork network = ServerNetworks.line(1, 1, 1);
        Placement placement = PlacementFixtures.placement(0, 1, 1, 2, 2, 0, 3, 2, 4, 0);
        Distribution distribution = new Distribution(hypergraph, placement, network);

        List<SteinerTree.ServerLink> tree = distribution.distributionTree(first);
        assertEquals(List.of(new SteinerTree.ServerLink(1, 0), new SteinerTree.ServerLink(1, 2)), tree);

        List<SteinerTree.ServerLink> other = distribution.distributionTree(second);
        assertEquals(List.of(new SteinerTree.ServerLink(2, 1), new SteinerTree.ServerLink(1, 0)), other);
    }

    @Test
    @DisplayName("Anchor occupancy ignores dependents")
    void testAnchorOccupancy() {
        ServerNetwork network = PlacementFixtures.twoServers(2);
        Placement placement = PlacementFixtures.placement(0, 0, 1, 0, 2, 0, 3, 0, 4, 1);
        Distribution distribution = new Distribution(hypergraph, placement, network);

        assertEquals(2, distribution.anchorOccupancy(0));
        assertEquals(0, distribution.anchorOccupancy(1));
    }

    @Test
    @DisplayName("Exception Path: missing vertex")
    void testNotTotal() {
        Placement placement = PlacementFixtures.placement(0, 0, 1, 1, 2, 0, 3, 0);
        Distribution distribution = new Distribution(hypergraph, placement, PlacementFixtures.twoServers(2));

        InvalidPlacementException ex = assertThrows(InvalidPlacementException.class, distribution::validate);
        assertEquals(InvalidPlacementException.REASON_NOT_TOTAL, ex.getReasonCode());
        assertFalse(distribution.isValid());
    }

    @Test
    @DisplayName("Exception Path: vertex outside the hypergraph")
    void testUnknownVertex() {
        Placement placement = PlacementFixtures.placement(0, 0, 1, 1, 2, 0, 3, 0, 4, 0, 9, 1);
        Distribution distribution = new Distribution(hypergraph, placement, PlacementFixtures.twoServers(2));

        InvalidPlacementException ex = assertThrows(InvalidPlacementException.class, distribution::validate);
        assertEquals(InvalidPlacementException.REASON_UNKNOWN_VERTEX, ex.getReasonCode());
    }

    @Test
    @DisplayName("Exception Path: unknown server")
    void testUnknownServer() {
        Placement placement = PlacementFixtures.placement(0, 0, 1, 1, 2, 0, 3, 0, 4, 5);
        Distribution distribution = new Distribution(hypergraph, placement, PlacementFixtures.twoServers(2));

        InvalidPlacementException ex = assertThrows(InvalidPlacementException.class, distribution::validate);
        assertEquals(InvalidPlacementException.REASON_UNKNOWN_SERVER, ex.getReasonCode());
    }

    @Test
    @DisplayName("Exception Path: capacity exceeded, assignment itself still usable")
    void testCapacityExceeded() {
        Placement placement = PlacementFixtures.placement(0, 0, 1, 0, 2, 1, 3, 1, 4, 1);
        Distribution distribution = new Distribution(hypergraph, placement, PlacementFixtures.twoServers(1));

        assertDoesNotThrow(distribution::validateAssignment);
        InvalidPlacementException ex = assertThrows(InvalidPlacementException.class, distribution::validate);
        assertEquals(InvalidPlacementException.REASON_CAPACITY_EXCEEDED, ex.getReasonCode());
        assertThrows(InvalidPlacementException.class, distribution::cost);
    }

    @Test
    @DisplayName("Exception Path: hyperedge outside the hypergraph")
    void testForeignHyperedge() {
        Placement placement = PlacementFixtures.placement(0, 0, 1, 1, 2, 0, 3, 0, 4, 1);
        Distribution distribution = new Distribution(hypergraph, placement, PlacementFixtures.twoServers(2));

        assertThrows(IllegalArgumentException.class, () -> distribution.hyperedgeCost(Hyperedge.of(0, 4)));
    }
}
