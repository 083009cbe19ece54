package org.span.optimizer;

import lombok.experimental.UtilityClass;
import org.span.hypergraph.Hypergraph;
import org.span.network.ServerNetwork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves anchors off over-capacity servers so that refinement starts from a valid placement.
 * <p>
 * Repair ignores gain: each offending anchor goes to the first server, in ascending
 * id order, that still has a free slot. Anchors that already fit are never touched.
 */
@UtilityClass
public final class CapacityRepair {
    private static final Logger log = LoggerFactory.getLogger(CapacityRepair.class);

    /**
     * @throws OptimizerException with {@code SPAN_INFEASIBLE_NETWORK} when the network
     *                            has fewer capacity slots than the hypergraph has anchors.
     */
    public static void ensureFeasible(Hypergraph hypergraph, ServerNetwork network) {
        if (hypergraph.anchorCount() > network.totalCapacity()) {
            throw new OptimizerException(
                    OptimizerException.REASON_INFEASIBLE_NETWORK,
                    "Network capacity " + network.totalCapacity()
                            + " cannot host " + hypergraph.anchorCount() + " anchor vertices");
        }
    }

    /**
     * Repairs capacity violations in place.
     *
     * @return number of anchors moved.
     */
    public static int repair(OptimizerState state) {
        ensureFeasible(state.hypergraph(), state.network());
        ServerNetwork network = state.network();
        int[] servers = network.serverIds();
        int repaired = 0;
        for (int anchor : state.hypergraph().anchorVertices()) {
            int current = state.currentServer(anchor);
            if (state.occupancy(current) <= network.capacity(current)) {
                continue;
            }
            int target = firstServerWithSpareCapacity(state, servers);
            state.move(anchor, target);
            repaired++;
            log.debug("Repaired anchor {}: server {} -> {}", anchor, current, target);
        }
        if (repaired > 0) {
            log.info("Capacity repair moved {} anchor vertices", repaired);
        }
        return repaired;
    }

    private static int firstServerWithSpareCapacity(OptimizerState state, int[] servers) {
        for (int server : servers) {
            if (state.occupancy(server) < state.network().capacity(server)) {
                return server;
            }
        }
        // unreachable once ensureFeasible passed: an overfull server implies a spare slot elsewhere
        throw new IllegalStateException("No server with spare capacity although the network is feasible");
    }
}
