package org.span.optimizer;

import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import org.span.hypergraph.Hypergraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Greedy label-propagation refinement over the placement frontier.
 * <p>
 * Each round visits frontier vertices in random order and moves every vertex to
 * the candidate server of highest gain. Candidates are the current server and the
 * servers of hyperedge neighbours; any other server contains no neighbour and can
 * only do worse. When a candidate is full the best compensating swap with one of
 * its anchors is priced instead, so every applied step preserves capacity.
 * </p>
 * <p>
 * The loop stops after {@code numRounds} rounds, or as soon as the fraction of
 * frontier vertices moved in a round is at most {@code stopParameter}.
 * </p>
 */
public final class BoundaryReallocationRefiner implements Refiner {
    private static final Logger log = LoggerFactory.getLogger(BoundaryReallocationRefiner.class);
    private static final int NO_PARTNER = Integer.MIN_VALUE;

    private final int numRounds;
    private final double stopParameter;
    private final boolean acceptZeroGainMoves;
    private final boolean reallocateAnchors;

    /**
     * @param numRounds maximum number of rounds, {@code >= 0}.
     * @param stopParameter moved-fraction threshold in {@code [0, 1]}.
     * @param acceptZeroGainMoves whether a move with zero gain counts as a move.
     * @param reallocateAnchors whether anchors may move at all.
     */
    public BoundaryReallocationRefiner(
            int numRounds,
            double stopParameter,
            boolean acceptZeroGainMoves,
            boolean reallocateAnchors
    ) {
        if (numRounds < 0) {
            throw new IllegalArgumentException("numRounds must be >= 0");
        }
        if (!(stopParameter >= 0.0d && stopParameter <= 1.0d)) {
            throw new IllegalArgumentException("stopParameter must be in [0, 1]");
        }
        this.numRounds = numRounds;
        this.stopParameter = stopParameter;
        this.acceptZeroGainMoves = acceptZeroGainMoves;
        this.reallocateAnchors = reallocateAnchors;
    }

    public static BoundaryReallocationRefiner fromConfig(OptimizerConfig config) {
        Objects.requireNonNull(config, "config");
        return new BoundaryReallocationRefiner(
                config.getNumRounds(),
                config.getStopParameter(),
                config.isAcceptZeroGainMoves(),
                config.isReallocateAnchors()
        );
    }

    @Override
    public boolean refine(OptimizerState state, SplittableRandom random) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(random, "random");
        if (state.isLocked()) {
            throw new OptimizerException(
                    OptimizerException.REASON_PLACEMENT_LOCKED,
                    "Cannot refine a placement after an embedding commitment");
        }
        Hypergraph hypergraph = state.hypergraph();

        boolean refined = CapacityRepair.repair(state) > 0;
        int round = 0;
        double proportionMoved = 1.0d;
        while (round < numRounds && proportionMoved > stopParameter) {
            int[] frontier = hypergraph.boundary(state::currentServer);
            shuffle(frontier, random);

            int visited = 0;
            int moves = 0;
            for (int vertex : frontier) {
                if (!reallocateAnchors && hypergraph.isAnchor(vertex)) {
                    continue;
                }
                visited++;
                if (reallocate(state, hypergraph, vertex, random)) {
                    moves++;
                }
            }
            refined |= moves > 0;
            round++;
            proportionMoved = visited == 0 ? 0.0d : (double) moves / visited;
            log.debug("Refinement round {}: frontier={}, moves={}, cost={}",
                    round, visited, moves, state.totalCost());
        }
        state.ensureCapacityInvariant();
        return refined;
    }

    /**
     * Applies the best move of one vertex, if any.
     *
     * @return {@code true} when the vertex moved.
     */
    private boolean reallocate(OptimizerState state, Hypergraph hypergraph, int vertex, SplittableRandom random) {
        int current = state.currentServer(vertex);
        IntRBTreeSet candidates = new IntRBTreeSet();
        candidates.add(current);
        for (int neighbour : hypergraph.neighbours(vertex)) {
            candidates.add(state.currentServer(neighbour));
        }

        int bestServer = current;
        int bestGain = Integer.MIN_VALUE;
        int bestPartner = NO_PARTNER;
        int ties = 0;
        for (int server : candidates) {
            int gain = state.gain(vertex, server);
            int partner = NO_PARTNER;
            if (!state.isMoveValid(vertex, server)) {
                Swap swap = bestSwap(state, vertex, server, current, random);
                if (swap == null) {
                    continue;
                }
                partner = swap.partner();
                gain += swap.gain();
            }
            if (gain > bestGain) {
                bestGain = gain;
                bestServer = server;
                bestPartner = partner;
                ties = 1;
            } else if (gain == bestGain && random.nextInt(++ties) == 0) {
                bestServer = server;
                bestPartner = partner;
            }
        }

        if (bestServer == current || (bestGain == 0 && !acceptZeroGainMoves)) {
            return false;
        }
        state.move(vertex, bestServer);
        if (bestPartner != NO_PARTNER) {
            state.move(bestPartner, current);
        }
        return true;
    }

    /**
     * Finds the anchor on {@code server} whose move to {@code home} gains most once
     * {@code vertex} has taken its place.
     *
     * @return best swap, or {@code null} when the server hosts no anchor.
     */
    private static Swap bestSwap(OptimizerState state, int vertex, int server, int home, SplittableRandom random) {
        int[] anchors = state.anchorsOn(server);
        if (anchors.length == 0) {
            return null;
        }
        return state.withSpeculativeMove(vertex, server, () -> {
            int bestPartner = anchors[0];
            int bestGain = Integer.MIN_VALUE;
            int ties = 0;
            for (int anchor : anchors) {
                int gain = state.gain(anchor, home);
                if (gain > bestGain) {
                    bestGain = gain;
                    bestPartner = anchor;
                    ties = 1;
                } else if (gain == bestGain && random.nextInt(++ties) == 0) {
                    bestPartner = anchor;
                }
            }
            return new Swap(bestPartner, bestGain);
        });
    }

    private record Swap(int partner, int gain) {
    }

    /**
     * In-place Fisher-Yates shuffle.
     */
    private static void shuffle(int[] array, SplittableRandom random) {
        for (int i = array.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = array[i];
            array[i] = array[j];
            array[j] = tmp;
        }
    }
}
