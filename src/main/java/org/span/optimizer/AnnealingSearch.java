package org.span.optimizer;

import org.span.hypergraph.Hypergraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Simulated-annealing search over single-vertex moves with forced swaps.
 * <p>
 * Iteration {@code i} proposes moving a uniformly random vertex to a uniformly
 * random other server. A move of an anchor into a full server is paired with a
 * random anchor of that server moving back. The proposal is accepted when a
 * uniform draw falls below {@code exp(gain / (T0 / (i + 1)))}, so improving moves
 * always pass and worsening moves pass less often as the search cools. The
 * search starts by repairing capacity violations and stops early once the
 * placement costs nothing.
 */
public final class AnnealingSearch implements Refiner {
    private static final Logger log = LoggerFactory.getLogger(AnnealingSearch.class);
    private static final int NO_PARTNER = Integer.MIN_VALUE;

    private final int iterations;
    private final double initialTemperature;

    public AnnealingSearch(int iterations, double initialTemperature) {
        if (iterations < 0) {
            throw new IllegalArgumentException("iterations must be >= 0");
        }
        if (!Double.isFinite(initialTemperature) || initialTemperature <= 0.0d) {
            throw new IllegalArgumentException("initialTemperature must be finite and > 0");
        }
        this.iterations = iterations;
        this.initialTemperature = initialTemperature;
    }

    public static AnnealingSearch fromConfig(OptimizerConfig config) {
        Objects.requireNonNull(config, "config");
        return new AnnealingSearch(config.getIterations(), config.getInitialTemperature());
    }

    /**
     * Acceptance threshold of a move at a given iteration.
     * <p>
     * Values {@code >= 1} mean certain acceptance; overflow saturates to
     * {@link Double#POSITIVE_INFINITY}.
     */
    public static double acceptance(int gain, int iteration, double initialTemperature) {
        double temperature = initialTemperature / (iteration + 1.0d);
        return Math.exp(gain / temperature);
    }

    /**
     * Repairs capacity, then runs the search in place.
     *
     * @return number of accepted proposals, repair moves excluded.
     */
    public int search(OptimizerState state, SplittableRandom random) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(random, "random");
        if (state.isLocked()) {
            throw new OptimizerException(
                    OptimizerException.REASON_PLACEMENT_LOCKED,
                    "Cannot anneal a placement after an embedding commitment");
        }
        CapacityRepair.repair(state);
        Hypergraph hypergraph = state.hypergraph();
        int[] vertices = hypergraph.vertices();
        int[] servers = state.network().serverIds();
        if (iterations == 0 || vertices.length == 0 || servers.length < 2) {
            return 0;
        }

        int accepted = 0;
        for (int i = 0; i < iterations; i++) {
            if (state.totalCost() == 0L) {
                break;
            }
            int vertex = vertices[random.nextInt(vertices.length)];
            int home = state.currentServer(vertex);
            int destination = randomOtherServer(servers, home, state, random);

            int partner = NO_PARTNER;
            if (!state.isMoveValid(vertex, destination)) {
                int[] anchors = state.anchorsOn(destination);
                if (anchors.length == 0) {
                    continue;
                }
                partner = anchors[random.nextInt(anchors.length)];
            }

            int gain = state.gain(vertex, destination);
            if (partner != NO_PARTNER) {
                int swapPartner = partner;
                gain += state.withSpeculativeMove(vertex, destination, () -> state.gain(swapPartner, home));
            }

            if (random.nextDouble() < acceptance(gain, i, initialTemperature)) {
                state.move(vertex, destination);
                if (partner != NO_PARTNER) {
                    state.move(partner, home);
                }
                accepted++;
            }
        }
        state.ensureCapacityInvariant();
        log.debug("Annealing accepted {} of {} proposals, cost={}", accepted, iterations, state.totalCost());
        return accepted;
    }

    @Override
    public boolean refine(OptimizerState state, SplittableRandom random) {
        Objects.requireNonNull(state, "state");
        boolean repaired = !state.isLocked() && CapacityRepair.repair(state) > 0;
        return search(state, random) > 0 || repaired;
    }

    private static int randomOtherServer(int[] servers, int home, OptimizerState state, SplittableRandom random) {
        int homeIndex = state.network().serverIndex().toInternal(home);
        int k = random.nextInt(servers.length - 1);
        if (k >= homeIndex) {
            k++;
        }
        return servers[k];
    }
}
