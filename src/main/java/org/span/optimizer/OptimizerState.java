package org.span.optimizer;

import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.span.core.id.ServerIndex;
import org.span.hypergraph.Hyperedge;
import org.span.hypergraph.Hypergraph;
import org.span.network.ServerNetwork;
import org.span.placement.Distribution;
import org.span.placement.InvalidPlacementException;
import org.span.placement.Placement;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Mutable optimizer state: the authoritative placement plus every cache derived from it.
 * <p>
 * Derived caches:
 * </p>
 * <ul>
 *     <li>anchors per server (occupancy is its size),</li>
 *     <li>cost per hyperedge and their running total,</li>
 *     <li>Steiner-tree memo keyed by server subset.</li>
 * </ul>
 * <p>
 * The state owns private copies of the hypergraph and placement it was created
 * from; callers observe it only through {@link #toDistribution()} snapshots.
 * Between public calls every cache equals a fresh recomputation from the
 * placement; the only exception is inside
 * {@link #withSpeculativeMove(int, int, Supplier)} and after
 * {@code move(v, s, false)}, where hyperedge costs are stale until the caller
 * restores the vertex.
 * </p>
 * This class is NOT thread-safe.
 */
public final class OptimizerState {
    private static final int NO_COST = -1;

    private final Hypergraph hypergraph;
    private final Placement placement;
    private final ServerNetwork network;
    private final ServerIndex serverIndex;
    private final SteinerCostCache steinerCache;

    // dense server index -> anchors currently placed there
    private final IntRBTreeSet[] anchorsByServer;
    private final Object2IntOpenHashMap<Hyperedge> hyperedgeCosts = new Object2IntOpenHashMap<>();
    private long totalCost;

    private final Set<Hyperedge> committed = new HashSet<>();
    private boolean locked;

    private OptimizerState(Distribution distribution, int cacheLimit) {
        this.hypergraph = distribution.hypergraph().copy();
        this.placement = distribution.placement().copy();
        this.network = distribution.network();
        this.serverIndex = network.serverIndex();
        this.steinerCache = new SteinerCostCache(network, cacheLimit);
        this.hyperedgeCosts.defaultReturnValue(NO_COST);

        this.anchorsByServer = new IntRBTreeSet[network.serverCount()];
        for (int i = 0; i < anchorsByServer.length; i++) {
            anchorsByServer[i] = new IntRBTreeSet();
        }
        for (int anchor : hypergraph.anchorVertices()) {
            anchorsByServer[serverIndex.toInternal(placement.serverOf(anchor))].add(anchor);
        }
        for (Hyperedge hyperedge : hypergraph.hyperedges()) {
            updateCost(hyperedge);
        }
    }

    /**
     * Builds the state over a copy of a distribution whose placement may still violate capacity.
     * Later changes to {@code distribution} do not reach the state, and vice versa.
     *
     * @throws OptimizerException with {@code SPAN_INVALID_PLACEMENT} when the placement is
     *                            not total or references unknown vertices or servers.
     */
    public static OptimizerState create(Distribution distribution, int cacheLimit) {
        Objects.requireNonNull(distribution, "distribution");
        try {
            distribution.validateAssignment();
        } catch (InvalidPlacementException ex) {
            throw new OptimizerException(OptimizerException.REASON_INVALID_PLACEMENT, ex.getMessage(), ex);
        }
        return new OptimizerState(distribution, cacheLimit);
    }

    // ========================================================================
    // COST QUERIES
    // ========================================================================

    /**
     * Steiner-tree edge count over a server set; duplicates are ignored.
     */
    public int steinerCost(int... serverIds) {
        return steinerCache.cost(new IntRBTreeSet(serverIds).toIntArray());
    }

    /**
     * Recomputes and stores the cost of {@code hyperedge} from the current placement.
     *
     * @throws IllegalArgumentException when the hyperedge is not in the state's hypergraph.
     */
    public void updateCost(Hyperedge hyperedge) {
        if (!hypergraph.containsHyperedge(hyperedge)) {
            throw new IllegalArgumentException(hyperedge + " is not in the hypergraph");
        }
        int cost = hyperedge.weight() * steinerCache.cost(serversOf(hyperedge));
        int previous = hyperedgeCosts.put(hyperedge, cost);
        totalCost += previous == NO_COST ? cost : cost - previous;
    }

    /**
     * Cached cost of a hyperedge in the hypergraph.
     */
    public int hyperedgeCost(Hyperedge hyperedge) {
        int cost = hyperedgeCosts.getInt(hyperedge);
        if (cost == NO_COST) {
            throw new IllegalArgumentException(hyperedge + " is not tracked by this state");
        }
        return cost;
    }

    /**
     * Running total of cached hyperedge costs.
     */
    public long totalCost() {
        return totalCost;
    }

    /**
     * Recomputes the total cost from scratch without reading any cache.
     */
    public long recomputeTotalCost() {
        long total = 0L;
        for (Hyperedge hyperedge : hypergraph.hyperedges()) {
            total += (long) hyperedge.weight() * network.steinerTree(serversOf(hyperedge)).edgeCount();
        }
        return total;
    }

    /**
     * Cost reduction of moving {@code vertex} to {@code serverId}; positive is an improvement.
     * <p>
     * A hyperedge only changes cost when the vertex is the last of its pins on the
     * current server or the first of its pins on the target server; every other
     * incident hyperedge is skipped.
     */
    public int gain(int vertex, int serverId) {
        int current = placement.serverOf(vertex);
        if (current == serverId) {
            return 0;
        }
        int gain = 0;
        for (Hyperedge hyperedge : hypergraph.incidentHyperedges(vertex)) {
            int pinsOnCurrent = 0;
            int pinsOnTarget = 0;
            IntRBTreeSet others = new IntRBTreeSet();
            for (int i = 0; i < hyperedge.vertexCount(); i++) {
                int member = hyperedge.vertexAt(i);
                if (member == vertex) {
                    continue;
                }
                int server = placement.serverOf(member);
                others.add(server);
                if (server == current) {
                    pinsOnCurrent++;
                } else if (server == serverId) {
                    pinsOnTarget++;
                }
            }
            if (pinsOnCurrent > 0 && pinsOnTarget > 0) {
                continue;
            }
            int before = steinerCostWith(others, current);
            int after = steinerCostWith(others, serverId);
            gain += hyperedge.weight() * (before - after);
        }
        return gain;
    }

    /**
     * Same value as {@link #gain(int, int)}, obtained by applying the move,
     * pricing the incident hyperedges and restoring the vertex.
     */
    public int gainByRecalculation(int vertex, int serverId) {
        if (placement.serverOf(vertex) == serverId) {
            return 0;
        }
        List<Hyperedge> incident = hypergraph.incidentHyperedges(vertex);
        int before = 0;
        for (Hyperedge hyperedge : incident) {
            before += hyperedgeCost(hyperedge);
        }
        int after = withSpeculativeMove(vertex, serverId, () -> {
            int sum = 0;
            for (Hyperedge hyperedge : incident) {
                sum += hyperedge.weight() * steinerCache.cost(serversOf(hyperedge));
            }
            return sum;
        });
        return before - after;
    }

    // ========================================================================
    // MOVES
    // ========================================================================

    /**
     * Moves a vertex and recalculates the cost of every incident hyperedge.
     *
     * @see #move(int, int, boolean)
     */
    public void move(int vertex, int serverId) {
        move(vertex, serverId, true);
    }

    /**
     * Unconditionally reassigns {@code vertex} to {@code serverId}.
     * <p>
     * Capacity is NOT checked; consult {@link #isMoveValid(int, int)} first when
     * the hard constraint must hold at the end of a move sequence. With
     * {@code recalculateCost == false} hyperedge costs go stale until the vertex
     * is moved back.
     *
     * @throws OptimizerException with {@code SPAN_PLACEMENT_LOCKED} after an embedding commitment.
     */
    public void move(int vertex, int serverId, boolean recalculateCost) {
        if (locked) {
            throw new OptimizerException(
                    OptimizerException.REASON_PLACEMENT_LOCKED,
                    "Vertex moves are rejected after an embedding commitment (vertex " + vertex + ")");
        }
        int target = serverIndex.toInternal(serverId);
        int current = placement.serverOf(vertex);
        if (hypergraph.isAnchor(vertex)) {
            anchorsByServer[serverIndex.toInternal(current)].remove(vertex);
            anchorsByServer[target].add(vertex);
        }
        placement.place(vertex, serverId);
        if (recalculateCost) {
            for (Hyperedge hyperedge : hypergraph.incidentHyperedges(vertex)) {
                updateCost(hyperedge);
            }
        }
    }

    /**
     * Runs {@code evaluation} while {@code vertex} temporarily sits on {@code serverId}.
     * <p>
     * The vertex is restored even when the evaluation throws. Hyperedge costs are not
     * recalculated in either direction, so the evaluation must price hyperedges itself
     * (for example through {@link #gain(int, int)}) rather than read cached costs.
     */
    public <T> T withSpeculativeMove(int vertex, int serverId, Supplier<T> evaluation) {
        int home = placement.serverOf(vertex);
        move(vertex, serverId, false);
        try {
            return evaluation.get();
        } finally {
            move(vertex, home, false);
        }
    }

    /**
     * True unless {@code vertex} is an anchor and the server would exceed capacity after the move.
     */
    public boolean isMoveValid(int vertex, int serverId) {
        if (!hypergraph.isAnchor(vertex)) {
            return true;
        }
        if (placement.serverOf(vertex) == serverId) {
            return true;
        }
        return occupancy(serverId) < network.capacity(serverId);
    }

    public int currentServer(int vertex) {
        return placement.serverOf(vertex);
    }

    /**
     * Number of anchors currently placed on the server.
     */
    public int occupancy(int serverId) {
        return anchorsByServer[serverIndex.toInternal(serverId)].size();
    }

    /**
     * Anchors currently placed on the server, ascending.
     */
    public int[] anchorsOn(int serverId) {
        return anchorsByServer[serverIndex.toInternal(serverId)].toIntArray();
    }

    public boolean isCapacityRespected() {
        for (int i = 0; i < anchorsByServer.length; i++) {
            if (anchorsByServer[i].size() > network.capacity(serverIndex.toExternal(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * @throws IllegalStateException when any server hosts more anchors than its capacity.
     */
    public void ensureCapacityInvariant() {
        for (int i = 0; i < anchorsByServer.length; i++) {
            int server = serverIndex.toExternal(i);
            if (anchorsByServer[i].size() > network.capacity(server)) {
                throw new IllegalStateException(
                        "Capacity invariant violated on server " + server + ": "
                                + anchorsByServer[i].size() + " > " + network.capacity(server));
            }
        }
    }

    // ========================================================================
    // STRUCTURAL EDITS
    // ========================================================================

    /**
     * Cost saved by replacing {@code hyperedges} with their union.
     */
    public int mergeHyperedgeGain(List<Hyperedge> hyperedges) {
        int before = 0;
        for (Hyperedge hyperedge : hyperedges) {
            before += costOf(hyperedge);
        }
        return before - costOf(Hyperedge.union(hyperedges));
    }

    /**
     * Replaces {@code hyperedges} with their union in the hypergraph and the cost cache.
     *
     * @return the merged hyperedge.
     * @throws OptimizerException with {@code SPAN_HYPEREDGE_COMMITTED} for committed inputs.
     */
    public Hyperedge mergeHyperedge(List<Hyperedge> hyperedges) {
        for (Hyperedge hyperedge : hyperedges) {
            requireNotCommitted(hyperedge);
        }
        Hyperedge merged = hypergraph.mergeHyperedges(hyperedges);
        for (Hyperedge hyperedge : hyperedges) {
            forgetCost(hyperedge);
        }
        updateCost(merged);
        return merged;
    }

    /**
     * Cost saved by replacing {@code old} with {@code parts}; usually negative.
     */
    public int splitHyperedgeGain(Hyperedge old, List<Hyperedge> parts) {
        int after = 0;
        for (Hyperedge part : parts) {
            after += costOf(part);
        }
        return costOf(old) - after;
    }

    /**
     * Replaces {@code old} with {@code parts} in the hypergraph and the cost cache.
     *
     * @throws OptimizerException with {@code SPAN_HYPEREDGE_COMMITTED} when {@code old} is committed.
     */
    public void splitHyperedge(Hyperedge old, List<Hyperedge> parts) {
        requireNotCommitted(old);
        hypergraph.splitHyperedge(old, parts);
        forgetCost(old);
        for (Hyperedge part : parts) {
            updateCost(part);
        }
    }

    /**
     * Records an irrevocable embedding decision for {@code hyperedge}.
     * From then on every vertex move is rejected, for all vertices.
     */
    public void commitEmbedding(Hyperedge hyperedge) {
        if (!hypergraph.containsHyperedge(hyperedge)) {
            throw new IllegalArgumentException(hyperedge + " is not in the hypergraph");
        }
        committed.add(hyperedge);
        locked = true;
    }

    public boolean isLocked() {
        return locked;
    }

    public boolean isCommitted(Hyperedge hyperedge) {
        return committed.contains(hyperedge);
    }

    // ========================================================================
    // VIEWS
    // ========================================================================

    /**
     * The live hypergraph, for structural edits inside the optimizer.
     */
    Hypergraph hypergraph() {
        return hypergraph;
    }

    public ServerNetwork network() {
        return network;
    }

    public SteinerCostCache steinerCache() {
        return steinerCache;
    }

    /**
     * Detached snapshot of the current hypergraph and placement.
     */
    public Distribution toDistribution() {
        return new Distribution(hypergraph.copy(), placement.copy(), network);
    }

    @Override
    public String toString() {
        return "OptimizerState[cost=" + totalCost + ", locked=" + locked + ", memo=" + steinerCache.size() + "]";
    }

    // ========================================================================
    // INTERNALS
    // ========================================================================

    private int[] serversOf(Hyperedge hyperedge) {
        IntRBTreeSet servers = new IntRBTreeSet();
        for (int i = 0; i < hyperedge.vertexCount(); i++) {
            servers.add(placement.serverOf(hyperedge.vertexAt(i)));
        }
        return servers.toIntArray();
    }

    private int steinerCostWith(IntRBTreeSet others, int server) {
        if (others.contains(server)) {
            return steinerCache.cost(others.toIntArray());
        }
        others.add(server);
        int cost = steinerCache.cost(others.toIntArray());
        others.remove(server);
        return cost;
    }

    private int costOf(Hyperedge hyperedge) {
        int cached = hyperedgeCosts.getInt(hyperedge);
        if (cached != NO_COST) {
            return cached;
        }
        return hyperedge.weight() * steinerCache.cost(serversOf(hyperedge));
    }

    private void forgetCost(Hyperedge hyperedge) {
        int previous = hyperedgeCosts.removeInt(hyperedge);
        if (previous != NO_COST) {
            totalCost -= previous;
        }
    }

    private void requireNotCommitted(Hyperedge hyperedge) {
        if (committed.contains(hyperedge)) {
            throw new OptimizerException(
                    OptimizerException.REASON_HYPEREDGE_COMMITTED,
                    hyperedge + " carries an embedding commitment and cannot be edited");
        }
    }
}
