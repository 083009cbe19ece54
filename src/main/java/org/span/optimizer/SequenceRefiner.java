package org.span.optimizer;

import java.util.List;
import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Runs refiners one after another.
 */
public final class SequenceRefiner implements Refiner {
    private final List<Refiner> refiners;

    public SequenceRefiner(List<Refiner> refiners) {
        this.refiners = List.copyOf(Objects.requireNonNull(refiners, "refiners"));
    }

    /**
     * @return {@code true} if any refiner in the sequence made a change.
     */
    @Override
    public boolean refine(OptimizerState state, SplittableRandom random) {
        boolean refined = false;
        for (Refiner refiner : refiners) {
            refined |= refiner.refine(state, random);
        }
        return refined;
    }
}
