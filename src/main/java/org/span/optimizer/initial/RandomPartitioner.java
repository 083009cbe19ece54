package org.span.optimizer.initial;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.span.hypergraph.Hypergraph;
import org.span.network.ServerNetwork;
import org.span.optimizer.OptimizerException;
import org.span.placement.Placement;

import java.util.SplittableRandom;

/**
 * Places anchors on uniformly random servers that still have a free slot and
 * dependents on uniformly random servers. The result respects capacity.
 */
public final class RandomPartitioner implements InitialPartitioner {

    @Override
    public Placement partition(Hypergraph hypergraph, ServerNetwork network, SplittableRandom random) {
        int[] servers = network.serverIds();
        int[] remaining = new int[servers.length];
        IntArrayList open = new IntArrayList();
        for (int i = 0; i < servers.length; i++) {
            remaining[i] = network.capacity(servers[i]);
            if (remaining[i] > 0) {
                open.add(i);
            }
        }

        Placement placement = new Placement();
        for (int vertex : hypergraph.vertices()) {
            if (!hypergraph.isAnchor(vertex)) {
                placement.place(vertex, servers[random.nextInt(servers.length)]);
                continue;
            }
            if (open.isEmpty()) {
                throw new OptimizerException(
                        OptimizerException.REASON_INFEASIBLE_NETWORK,
                        "No free server slot left for anchor " + vertex);
            }
            int slot = random.nextInt(open.size());
            int index = open.getInt(slot);
            placement.place(vertex, servers[index]);
            if (--remaining[index] == 0) {
                open.removeInt(slot);
            }
        }
        return placement;
    }
}
