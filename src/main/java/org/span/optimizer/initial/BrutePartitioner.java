package org.span.optimizer.initial;

import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import org.span.hypergraph.Hyperedge;
import org.span.hypergraph.Hypergraph;
import org.span.network.ServerNetwork;
import org.span.optimizer.OptimizerException;
import org.span.optimizer.SteinerCostCache;
import org.span.placement.Placement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Exhaustive partitioner returning the cheapest valid placement.
 * <p>
 * Candidates are enumerated in lexicographic order over (vertex ascending, server
 * ascending) and the first candidate of minimum cost wins, so the result is
 * deterministic. Only usable for tiny instances; the candidate count is checked
 * against an {@link ExhaustiveSearchBudget} before any work starts.
 */
public final class BrutePartitioner implements InitialPartitioner {
    private static final Logger log = LoggerFactory.getLogger(BrutePartitioner.class);

    private final ExhaustiveSearchBudget budget;

    public BrutePartitioner() {
        this(ExhaustiveSearchBudget.defaults());
    }

    public BrutePartitioner(ExhaustiveSearchBudget budget) {
        this.budget = Objects.requireNonNull(budget, "budget");
    }

    /**
     * @param random unused.
     * @throws OptimizerException with {@code SPAN_SEARCH_BUDGET_EXCEEDED} when the search
     *                            space is too large, or {@code SPAN_NO_VALID_PLACEMENT}
     *                            when no candidate respects capacity.
     */
    @Override
    public Placement partition(Hypergraph hypergraph, ServerNetwork network, SplittableRandom random) {
        int[] vertices = hypergraph.vertices();
        int[] servers = network.serverIds();
        long candidates = ExhaustiveSearchBudget.candidateCount(servers.length, vertices.length);
        budget.checkCandidates(candidates);

        boolean[] anchor = new boolean[vertices.length];
        for (int i = 0; i < vertices.length; i++) {
            anchor[i] = hypergraph.isAnchor(vertices[i]);
        }
        int[] capacity = new int[servers.length];
        for (int s = 0; s < servers.length; s++) {
            capacity[s] = network.capacity(servers[s]);
        }

        SteinerCostCache steinerCache = new SteinerCostCache(network, servers.length);
        List<Hyperedge> hyperedges = hypergraph.hyperedges();
        int[] digits = new int[vertices.length];
        int[] best = null;
        long bestCost = Long.MAX_VALUE;
        long enumerated = 0L;
        do {
            enumerated++;
            if (!respectsCapacity(digits, anchor, capacity)) {
                continue;
            }
            long cost = cost(hyperedges, vertices, servers, digits, steinerCache);
            if (cost < bestCost) {
                bestCost = cost;
                best = digits.clone();
            }
        } while (advance(digits, servers.length));

        if (best == null) {
            throw new OptimizerException(
                    OptimizerException.REASON_NO_VALID_PLACEMENT,
                    "No valid placement exists among " + enumerated + " candidates");
        }
        log.debug("Exhaustive search enumerated {} candidates, best cost {}", enumerated, bestCost);

        Placement placement = new Placement();
        for (int i = 0; i < vertices.length; i++) {
            placement.place(vertices[i], servers[best[i]]);
        }
        return placement;
    }

    private static boolean respectsCapacity(int[] digits, boolean[] anchor, int[] capacity) {
        int[] used = new int[capacity.length];
        for (int i = 0; i < digits.length; i++) {
            if (anchor[i] && ++used[digits[i]] > capacity[digits[i]]) {
                return false;
            }
        }
        return true;
    }

    private static long cost(
            List<Hyperedge> hyperedges,
            int[] vertices,
            int[] servers,
            int[] digits,
            SteinerCostCache steinerCache
    ) {
        long total = 0L;
        for (Hyperedge hyperedge : hyperedges) {
            IntRBTreeSet occupied = new IntRBTreeSet();
            for (int i = 0; i < hyperedge.vertexCount(); i++) {
                int position = Arrays.binarySearch(vertices, hyperedge.vertexAt(i));
                occupied.add(servers[digits[position]]);
            }
            total += (long) hyperedge.weight() * steinerCache.cost(occupied.toIntArray());
        }
        return total;
    }

    /**
     * Odometer increment; the last vertex varies fastest.
     *
     * @return {@code false} once every candidate has been produced.
     */
    private static boolean advance(int[] digits, int base) {
        for (int i = digits.length - 1; i >= 0; i--) {
            if (++digits[i] < base) {
                return true;
            }
            digits[i] = 0;
        }
        return false;
    }
}
