package com.caret.analyze.lookup;

/**
 * Configuration for fuzzy lookups.
 *
 * @param threshold similarity at or below which the best candidate is reported as
 *                  not found rather than suggested
 */
public record LookupConfig(double threshold) {

    static final double DEFAULT_THRESHOLD = 0.6;

    public LookupConfig {
        validateThreshold(threshold);
    }

    /**
     * Default configuration: threshold 0.6.
     */
    public static LookupConfig defaults() {
        return new LookupConfig(DEFAULT_THRESHOLD);
    }

    /**
     * Creates a copy of this configuration with a different threshold.
     */
    public LookupConfig withThreshold(double newThreshold) {
        return new LookupConfig(newThreshold);
    }

    static void validateThreshold(double threshold) {
        if (!(threshold >= 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0, got " + threshold);
        }
    }
}
