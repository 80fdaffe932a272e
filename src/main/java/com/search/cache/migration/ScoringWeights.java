package com.search.cache.migration;

/**
 * Weights of the recency/frequency blend used to rank warm entries.
 *
 * @param frequencyWeight weight of accesses per second of age
 * @param recencyWeight   weight of {@code 1 / (1 + secondsSinceLastAccess)}
 */
public record ScoringWeights(double frequencyWeight, double recencyWeight) {

    public ScoringWeights {
        if (frequencyWeight < 0 || recencyWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = frequencyWeight + recencyWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * Default weights, leaning on frequency as the warm tier is meant for
     * entries that are re-read over a longer horizon.
     */
    public static ScoringWeights defaultWeights() {
        return new ScoringWeights(0.7, 0.3);
    }

    /**
     * Pure access rate, {@code accessCount / age}.
     */
    public static ScoringWeights frequencyOnly() {
        return new ScoringWeights(1.0, 0.0);
    }

    /**
     * Pure recency, equivalent to least-recently-used.
     */
    public static ScoringWeights recencyOnly() {
        return new ScoringWeights(0.0, 1.0);
    }
}
