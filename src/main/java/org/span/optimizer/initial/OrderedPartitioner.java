package org.span.optimizer.initial;

import org.span.hypergraph.Hypergraph;
import org.span.network.ServerNetwork;
import org.span.optimizer.OptimizerException;
import org.span.placement.Placement;

import java.util.Arrays;
import java.util.SplittableRandom;

/**
 * Deterministic partitioner: anchors fill servers in decreasing-capacity order
 * (ties by ascending id), and every dependent goes to the largest server.
 */
public final class OrderedPartitioner implements InitialPartitioner {

    /**
     * @param random unused.
     */
    @Override
    public Placement partition(Hypergraph hypergraph, ServerNetwork network, SplittableRandom random) {
        Integer[] order = Arrays.stream(network.serverIds()).boxed().toArray(Integer[]::new);
        Arrays.sort(order, (a, b) -> {
            int byCapacity = Integer.compare(network.capacity(b), network.capacity(a));
            return byCapacity != 0 ? byCapacity : Integer.compare(a, b);
        });

        Placement placement = new Placement();
        int serverPosition = 0;
        int used = 0;
        for (int anchor : hypergraph.anchorVertices()) {
            while (serverPosition < order.length && used >= network.capacity(order[serverPosition])) {
                serverPosition++;
                used = 0;
            }
            if (serverPosition == order.length) {
                throw new OptimizerException(
                        OptimizerException.REASON_INFEASIBLE_NETWORK,
                        "No free server slot left for anchor " + anchor);
            }
            placement.place(anchor, order[serverPosition]);
            used++;
        }

        int largest = order[0];
        for (int vertex : hypergraph.vertices()) {
            if (!hypergraph.isAnchor(vertex)) {
                placement.place(vertex, largest);
            }
        }
        return placement;
    }
}
