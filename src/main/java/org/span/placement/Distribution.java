package org.span.placement;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.span.hypergraph.Hyperedge;
import org.span.hypergraph.Hypergraph;
import org.span.network.ServerNetwork;
import org.span.network.SteinerTree;

import java.util.List;
import java.util.Objects;

/**
 * A hypergraph placed onto a server network.
 * <p>
 * Cost is always recomputed from scratch here; incremental bookkeeping lives in
 * the optimizer. The three parts are held by reference, so edits to the
 * hypergraph or placement are visible through this object.
 */
@Getter
@Accessors(fluent = true)
public final class Distribution {
    private final Hypergraph hypergraph;
    private final Placement placement;
    private final ServerNetwork network;

    public Distribution(Hypergraph hypergraph, Placement placement, ServerNetwork network) {
        this.hypergraph = Objects.requireNonNull(hypergraph, "hypergraph");
        this.placement = Objects.requireNonNull(placement, "placement");
        this.network = Objects.requireNonNull(network, "network");
    }

    public boolean isValid() {
        try {
            validate();
            return true;
        } catch (InvalidPlacementException ex) {
            return false;
        }
    }

    /**
     * Checks totality, vertex and server membership, then anchor capacity.
     *
     * @throws InvalidPlacementException carrying the first violated reason code.
     */
    public void validate() {
        validateAssignment();
        for (int server : network.serverIds()) {
            int used = anchorOccupancy(server);
            if (used > network.capacity(server)) {
                throw new InvalidPlacementException(
                        InvalidPlacementException.REASON_CAPACITY_EXCEEDED,
                        "Server " + server + " hosts " + used + " anchors, capacity " + network.capacity(server));
            }
        }
    }

    /**
     * Checks that every hypergraph vertex sits on a known server, ignoring capacity.
     *
     * @throws InvalidPlacementException carrying the first violated reason code.
     */
    public void validateAssignment() {
        for (int vertex : placement.vertices()) {
            if (!hypergraph.containsVertex(vertex)) {
                throw new InvalidPlacementException(
                        InvalidPlacementException.REASON_UNKNOWN_VERTEX,
                        "Placement assigns vertex " + vertex + " which is not in the hypergraph");
            }
        }
        if (!hypergraph.isPlacement(placement.vertices())) {
            throw new InvalidPlacementException(
                    InvalidPlacementException.REASON_NOT_TOTAL,
                    "Placement covers " + placement.size() + " of " + hypergraph.vertexCount() + " vertices");
        }

        for (int vertex : placement.vertices()) {
            int server = placement.serverOf(vertex);
            if (!network.containsServer(server)) {
                throw new InvalidPlacementException(
                        InvalidPlacementException.REASON_UNKNOWN_SERVER,
                        "Vertex " + vertex + " is placed on unknown server " + server);
            }
        }
    }

    /**
     * Total communication cost of the placement.
     *
     * @throws InvalidPlacementException when the placement is invalid.
     */
    public long cost() {
        validate();
        long total = 0L;
        for (Hyperedge hyperedge : hypergraph.hyperedges()) {
            total += hyperedgeCost(hyperedge);
        }
        return total;
    }

    /**
     * Weight times the Steiner-tree edge count over the servers {@code hyperedge} occupies.
     */
    public int hyperedgeCost(Hyperedge hyperedge) {
        return hyperedge.weight() * steinerTree(hyperedge).edgeCount();
    }

    /**
     * Directed Steiner tree of {@code hyperedge}, rooted at the server hosting its anchor.
     */
    public List<SteinerTree.ServerLink> distributionTree(Hyperedge hyperedge) {
        int origin = placement.serverOf(hypergraph.anchorOf(hyperedge));
        return steinerTree(hyperedge).directedFrom(origin);
    }

    /**
     * Number of anchors placed on {@code serverId}.
     */
    public int anchorOccupancy(int serverId) {
        int count = 0;
        for (int vertex : placement.verticesIn(serverId)) {
            if (hypergraph.containsVertex(vertex) && hypergraph.isAnchor(vertex)) {
                count++;
            }
        }
        return count;
    }

    private SteinerTree steinerTree(Hyperedge hyperedge) {
        if (!hypergraph.containsHyperedge(hyperedge)) {
            throw new IllegalArgumentException(hyperedge + " is not in the hypergraph");
        }
        int[] servers = new int[hyperedge.vertexCount()];
        for (int i = 0; i < servers.length; i++) {
            servers[i] = placement.serverOf(hyperedge.vertexAt(i));
        }
        return network.steinerTree(servers);
    }

    @Override
    public String toString() {
        return "Distribution[" + hypergraph + ", " + network + "]";
    }
}
