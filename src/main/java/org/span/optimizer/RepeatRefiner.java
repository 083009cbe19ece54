package org.span.optimizer;

import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Repeats a refiner until it reports no change or the repetition bound is reached.
 */
public final class RepeatRefiner implements Refiner {
    public static final int DEFAULT_MAX_REPETITIONS = 1_000;

    private final Refiner refiner;
    private final int maxRepetitions;

    public RepeatRefiner(Refiner refiner) {
        this(refiner, DEFAULT_MAX_REPETITIONS);
    }

    public RepeatRefiner(Refiner refiner, int maxRepetitions) {
        this.refiner = Objects.requireNonNull(refiner, "refiner");
        if (maxRepetitions <= 0) {
            throw new IllegalArgumentException("maxRepetitions must be > 0");
        }
        this.maxRepetitions = maxRepetitions;
    }

    /**
     * @return {@code true} if the first run made a change.
     */
    @Override
    public boolean refine(OptimizerState state, SplittableRandom random) {
        boolean refined = refiner.refine(state, random);
        boolean last = refined;
        for (int repetition = 1; last && repetition < maxRepetitions; repetition++) {
            last = refiner.refine(state, random);
        }
        return refined;
    }
}
