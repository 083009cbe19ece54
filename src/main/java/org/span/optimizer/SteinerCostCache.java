package org.span.optimizer;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.span.network.ServerNetwork;

import java.util.Objects;

/**
 * Memo of Steiner-tree edge counts keyed by server subset.
 * <p>
 * Only subsets with at most {@code cacheLimit} servers are memoized; larger
 * subsets are solved on every request and never stored, so memory stays
 * bounded by the number of small subsets. A limit of {@code 0} disables the memo.
 */
public final class SteinerCostCache {
    private static final int MISSING = -1;

    private final ServerNetwork network;
    private final int cacheLimit;
    private final Object2IntOpenHashMap<IntArrayList> memo = new Object2IntOpenHashMap<>();
    private long computations;

    public SteinerCostCache(ServerNetwork network, int cacheLimit) {
        this.network = Objects.requireNonNull(network, "network");
        if (cacheLimit < 0) {
            throw new IllegalArgumentException("cacheLimit must be >= 0");
        }
        this.cacheLimit = cacheLimit;
        this.memo.defaultReturnValue(MISSING);
    }

    /**
     * Edge count of a Steiner tree connecting the given servers.
     *
     * @param sortedServerIds non-empty server ids, ascending and distinct.
     */
    public int cost(int[] sortedServerIds) {
        if (sortedServerIds.length == 0) {
            throw new IllegalArgumentException("No servers have been provided");
        }
        if (sortedServerIds.length > cacheLimit) {
            return solve(sortedServerIds);
        }
        int cached = memo.getInt(IntArrayList.wrap(sortedServerIds));
        if (cached != MISSING) {
            return cached;
        }
        int cost = solve(sortedServerIds);
        memo.put(new IntArrayList(sortedServerIds), cost);
        return cost;
    }

    /**
     * Number of Steiner trees actually solved, memo hits excluded.
     */
    public long computations() {
        return computations;
    }

    /**
     * Number of memoized subsets.
     */
    public int size() {
        return memo.size();
    }

    public int cacheLimit() {
        return cacheLimit;
    }

    private int solve(int[] sortedServerIds) {
        computations++;
        return network.steinerTree(sortedServerIds).edgeCount();
    }
}
