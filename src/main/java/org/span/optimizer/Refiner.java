package org.span.optimizer;

import java.util.SplittableRandom;

/**
 * In-place improvement pass over an optimizer state.
 */
@FunctionalInterface
public interface Refiner {

    /**
     * Refines the state in place.
     *
     * @param state state to refine; its placement must respect capacity on entry.
     * @param random the run's single random source.
     * @return {@code true} when at least one change was made.
     */
    boolean refine(OptimizerState state, SplittableRandom random);
}
