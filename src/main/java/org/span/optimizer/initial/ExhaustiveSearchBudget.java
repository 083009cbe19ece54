package org.span.optimizer.initial;

import org.span.optimizer.OptimizerException;

/**
 * Bound on the number of candidate placements an exhaustive search may enumerate.
 */
public final class ExhaustiveSearchBudget {
    public static final long UNBOUNDED = Long.MAX_VALUE;
    public static final long DEFAULT_MAX_CANDIDATES = 1_000_000L;

    private static final String PROP_MAX_CANDIDATES = "span.initial.maxCandidates";

    private final long maxCandidates;

    private ExhaustiveSearchBudget(long maxCandidates) {
        this.maxCandidates = normalizeBound(maxCandidates);
    }

    /**
     * Creates a budget with an explicit bound; {@code <= 0} means unbounded.
     */
    public static ExhaustiveSearchBudget of(long maxCandidates) {
        return new ExhaustiveSearchBudget(maxCandidates);
    }

    /**
     * Loads the bound from {@code span.initial.maxCandidates}, falling back to
     * {@link #DEFAULT_MAX_CANDIDATES} when absent or unparsable.
     */
    public static ExhaustiveSearchBudget defaults() {
        return of(readBound(PROP_MAX_CANDIDATES));
    }

    public long maxCandidates() {
        return maxCandidates;
    }

    /**
     * Number of candidates for {@code vertexCount} vertices over {@code serverCount}
     * servers, saturating at {@link #UNBOUNDED}.
     */
    static long candidateCount(int serverCount, int vertexCount) {
        long count = 1L;
        for (int i = 0; i < vertexCount; i++) {
            if (count > Long.MAX_VALUE / Math.max(serverCount, 1)) {
                return UNBOUNDED;
            }
            count *= serverCount;
        }
        return count;
    }

    /**
     * @throws OptimizerException with {@code SPAN_SEARCH_BUDGET_EXCEEDED} when over budget.
     */
    void checkCandidates(long candidates) {
        if (candidates > maxCandidates) {
            throw new OptimizerException(
                    OptimizerException.REASON_SEARCH_BUDGET_EXCEEDED,
                    "exhaustive search budget exceeded: " + candidates + " > " + maxCandidates);
        }
    }

    private static long normalizeBound(long bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    private static long readBound(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_MAX_CANDIDATES;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            return DEFAULT_MAX_CANDIDATES;
        }
    }
}
