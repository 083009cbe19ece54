package org.span.optimizer.initial;

import org.span.hypergraph.Hypergraph;
import org.span.network.ServerNetwork;
import org.span.placement.Placement;

import java.util.SplittableRandom;

/**
 * Produces a first-cut placement for the optimizer to refine.
 * <p>
 * The result must be total and use only known servers; it may violate capacity,
 * since the optimizer repairs capacity before refining.
 */
@FunctionalInterface
public interface InitialPartitioner {

    /**
     * @param hypergraph vertices to place.
     * @param network target servers.
     * @param random the run's single random source.
     * @return total placement of {@code hypergraph}.
     */
    Placement partition(Hypergraph hypergraph, ServerNetwork network, SplittableRandom random);
}
