package org.span.optimizer;

/**
 * Local-search strategy run after capacity repair.
 */
public enum SearchStrategy {
    /** Boundary reallocation rounds only. */
    REFINEMENT,
    /** Simulated annealing only. */
    ANNEALING,
    /** Annealing, then boundary reallocation to settle the result. */
    ANNEALING_THEN_REFINEMENT
}
