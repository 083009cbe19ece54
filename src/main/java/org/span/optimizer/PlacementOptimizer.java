package org.span.optimizer;

import lombok.Builder;
import org.span.hypergraph.Hypergraph;
import org.span.network.ServerNetwork;
import org.span.optimizer.initial.InitialPartitioner;
import org.span.optimizer.initial.RandomPartitioner;
import org.span.placement.Distribution;
import org.span.placement.InvalidPlacementException;
import org.span.placement.Placement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Main placement optimization entry point.
 *
 * <p>One run goes through these stages:</p>
 * <ul>
 * <li>Reject networks that cannot host every anchor.</li>
 * <li>Obtain a first-cut placement from the injected {@link InitialPartitioner} ({@link #optimize} only).</li>
 * <li>Repair capacity violations.</li>
 * <li>Run the configured {@link SearchStrategy}.</li>
 * <li>Optionally merge hyperedges and refine once more.</li>
 * <li>Check capacity and cost consistency before handing the distribution back.</li>
 * </ul>
 * <p>Every stochastic step draws from one {@link SplittableRandom} created per run from
 * {@link OptimizerConfig#newRandom()}, so a seeded config reproduces a run exactly.</p>
 */
public final class PlacementOptimizer {
    private static final Logger log = LoggerFactory.getLogger(PlacementOptimizer.class);

    private final OptimizerConfig config;
    private final InitialPartitioner initialPartitioner;
    private final HyperedgeEditPolicy editPolicy;

    /**
     * @param config run configuration, defaults when {@code null}.
     * @param initialPartitioner first-cut placement oracle, {@link RandomPartitioner} when {@code null}.
     * @param editPolicy merge/split legality, {@link HyperedgeEditPolicy#permitAll()} when {@code null}.
     */
    @Builder
    public PlacementOptimizer(
            OptimizerConfig config,
            InitialPartitioner initialPartitioner,
            HyperedgeEditPolicy editPolicy
    ) {
        this.config = (config == null ? OptimizerConfig.defaults() : config).validate();
        this.initialPartitioner = initialPartitioner == null ? new RandomPartitioner() : initialPartitioner;
        this.editPolicy = editPolicy == null ? HyperedgeEditPolicy.permitAll() : editPolicy;
    }

    public OptimizerConfig config() {
        return config;
    }

    /**
     * Places {@code hypergraph} onto {@code network} from scratch.
     *
     * @return a valid distribution.
     * @throws OptimizerException when the network is infeasible or the partitioner fails.
     */
    public Distribution optimize(Hypergraph hypergraph, ServerNetwork network) {
        Objects.requireNonNull(hypergraph, "hypergraph");
        Objects.requireNonNull(network, "network");
        CapacityRepair.ensureFeasible(hypergraph, network);
        SplittableRandom random = config.newRandom();

        Placement initial;
        try {
            initial = initialPartitioner.partition(hypergraph, network, random);
        } catch (OptimizerException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new OptimizerException(
                    OptimizerException.REASON_PARTITIONER_FAILED,
                    "Initial partitioner failed: " + ex.getMessage(),
                    ex
            );
        }
        if (initial == null) {
            throw new OptimizerException(
                    OptimizerException.REASON_PARTITIONER_FAILED,
                    "Initial partitioner returned no placement");
        }

        Distribution distribution = new Distribution(hypergraph, initial, network);
        try {
            distribution.validateAssignment();
        } catch (InvalidPlacementException ex) {
            throw new OptimizerException(
                    OptimizerException.REASON_PARTITIONER_FAILED,
                    "Initial partitioner returned an unusable placement: " + ex.getMessage(),
                    ex
            );
        }
        return run(OptimizerState.create(distribution, config.getCacheLimit()), random);
    }

    /**
     * Improves an existing distribution; the argument itself is left untouched.
     *
     * @param distribution distribution whose placement is total; capacity may be violated.
     * @return a new, valid distribution over the same network.
     * @throws OptimizerException when the network is infeasible or the placement is not usable.
     */
    public Distribution refine(Distribution distribution) {
        Objects.requireNonNull(distribution, "distribution");
        CapacityRepair.ensureFeasible(distribution.hypergraph(), distribution.network());
        OptimizerState state = OptimizerState.create(distribution, config.getCacheLimit());
        return run(state, config.newRandom());
    }

    private Distribution run(OptimizerState state, SplittableRandom random) {
        Hypergraph hypergraph = state.hypergraph();
        log.info("Optimizing {} vertices / {} hyperedges onto {} servers: strategy={}, initialCost={}",
                hypergraph.vertexCount(), hypergraph.hyperedgeCount(), state.network().serverCount(),
                config.getStrategy(), state.totalCost());

        CapacityRepair.repair(state);
        state.ensureCapacityInvariant();

        searchRefiner().refine(state, random);
        if (config.isMergeHyperedges()) {
            new SequenceRefiner(List.of(
                    new SequentialMergeRefiner(editPolicy),
                    BoundaryReallocationRefiner.fromConfig(config)
            )).refine(state, random);
        }

        state.ensureCapacityInvariant();
        long recomputed = state.recomputeTotalCost();
        if (recomputed != state.totalCost()) {
            throw new IllegalStateException(
                    "Cost cache diverged: cached " + state.totalCost() + " != recomputed " + recomputed);
        }
        Distribution result = state.toDistribution();
        try {
            result.validate();
        } catch (InvalidPlacementException ex) {
            throw new IllegalStateException("Optimizer produced an invalid distribution", ex);
        }
        log.info("Optimization finished: hyperedges={}, finalCost={}, steinerComputations={}",
                hypergraph.hyperedgeCount(), state.totalCost(), state.steinerCache().computations());
        return result;
    }

    private Refiner searchRefiner() {
        return switch (config.getStrategy()) {
            case REFINEMENT -> BoundaryReallocationRefiner.fromConfig(config);
            case ANNEALING -> AnnealingSearch.fromConfig(config);
            case ANNEALING_THEN_REFINEMENT -> new SequenceRefiner(List.of(
                    AnnealingSearch.fromConfig(config),
                    BoundaryReallocationRefiner.fromConfig(config)
            ));
        };
    }
}
