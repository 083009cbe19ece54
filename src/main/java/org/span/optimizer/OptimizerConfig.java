package org.span.optimizer;

import lombok.Builder;
import lombok.Value;

import java.util.Locale;
import java.util.SplittableRandom;

/**
 * Tuning knobs for a placement optimizer run.
 */
@Value
@Builder(toBuilder = true)
public class OptimizerConfig {
    private static final String PROP_PREFIX = "span.optimizer.";

    /**
     * Seed for the run's single random source. {@code null} means nondeterministic.
     */
    Long seed;

    /**
     * Annealing iteration count.
     */
    @Builder.Default
    int iterations = 10_000;

    /**
     * Annealing start temperature; temperature at iteration {@code i} is {@code T0 / (i + 1)}.
     */
    @Builder.Default
    double initialTemperature = 3.0d;

    /**
     * Upper bound on boundary reallocation rounds.
     */
    @Builder.Default
    int numRounds = 1_000;

    /**
     * Refinement stops once the fraction of frontier vertices moved in a round drops to this value.
     */
    @Builder.Default
    double stopParameter = 0.05d;

    /**
     * Largest server-subset cardinality whose Steiner cost is memoized.
     */
    @Builder.Default
    int cacheLimit = 5;

    @Builder.Default
    boolean acceptZeroGainMoves = true;

    /**
     * Whether anchors are allowed to move during boundary reallocation.
     */
    @Builder.Default
    boolean reallocateAnchors = true;

    @Builder.Default
    SearchStrategy strategy = SearchStrategy.REFINEMENT;

    /**
     * Runs a sequential hyperedge merge pass plus a second refinement after the main search.
     */
    @Builder.Default
    boolean mergeHyperedges = false;

    public static OptimizerConfig defaults() {
        return OptimizerConfig.builder().build();
    }

    /**
     * Loads values from {@code span.optimizer.*} system properties.
     * Blank or unparsable values fall back to defaults.
     */
    public static OptimizerConfig fromSystemProperties() {
        OptimizerConfig defaults = defaults();
        return OptimizerConfig.builder()
                .seed(readLong(PROP_PREFIX + "seed", defaults.seed))
                .iterations(readInt(PROP_PREFIX + "iterations", defaults.iterations))
                .initialTemperature(readDouble(PROP_PREFIX + "initialTemperature", defaults.initialTemperature))
                .numRounds(readInt(PROP_PREFIX + "numRounds", defaults.numRounds))
                .stopParameter(readDouble(PROP_PREFIX + "stopParameter", defaults.stopParameter))
                .cacheLimit(readInt(PROP_PREFIX + "cacheLimit", defaults.cacheLimit))
                .acceptZeroGainMoves(readBoolean(PROP_PREFIX + "acceptZeroGainMoves", defaults.acceptZeroGainMoves))
                .reallocateAnchors(readBoolean(PROP_PREFIX + "reallocateAnchors", defaults.reallocateAnchors))
                .strategy(readStrategy(PROP_PREFIX + "strategy", defaults.strategy))
                .mergeHyperedges(readBoolean(PROP_PREFIX + "mergeHyperedges", defaults.mergeHyperedges))
                .build();
    }

    /**
     * Validates ranges.
     *
     * @return this config.
     * @throws IllegalArgumentException when a value is out of range.
     */
    public OptimizerConfig validate() {
        if (iterations < 0) {
            throw new IllegalArgumentException("iterations must be >= 0");
        }
        if (!Double.isFinite(initialTemperature) || initialTemperature <= 0.0d) {
            throw new IllegalArgumentException("initialTemperature must be finite and > 0");
        }
        if (numRounds < 0) {
            throw new IllegalArgumentException("numRounds must be >= 0");
        }
        if (!(stopParameter >= 0.0d && stopParameter <= 1.0d)) {
            throw new IllegalArgumentException("stopParameter must be in [0, 1]");
        }
        if (cacheLimit < 0) {
            throw new IllegalArgumentException("cacheLimit must be >= 0");
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy must be provided");
        }
        return this;
    }

    /**
     * Creates the random source threaded through every stochastic step of a run.
     */
    public SplittableRandom newRandom() {
        return seed == null ? new SplittableRandom() : new SplittableRandom(seed);
    }

    private static String readRaw(String property) {
        String raw = System.getProperty(property);
        return raw == null || raw.isBlank() ? null : raw.trim();
    }

    private static Long readLong(String property, Long fallback) {
        String raw = readRaw(property);
        if (raw == null) {
            return fallback;
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static int readInt(String property, int fallback) {
        String raw = readRaw(property);
        if (raw == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static double readDouble(String property, double fallback) {
        String raw = readRaw(property);
        if (raw == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static boolean readBoolean(String property, boolean fallback) {
        String raw = readRaw(property);
        if ("true".equalsIgnoreCase(raw)) {
            return true;
        }
        if ("false".equalsIgnoreCase(raw)) {
            return false;
        }
        return fallback;
    }

    private static SearchStrategy readStrategy(String property, SearchStrategy fallback) {
        String raw = readRaw(property);
        if (raw == null) {
            return fallback;
        }
        try {
            return SearchStrategy.valueOf(raw.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return fallback;
        }
    }
}
