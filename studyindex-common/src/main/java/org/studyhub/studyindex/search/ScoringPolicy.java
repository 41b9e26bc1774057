package org.studyhub.studyindex.search;

/**
 * Converts a raw vector distance into a relevance score in [0, 1].
 */
public enum ScoringPolicy {

    /**
     * {@code 1 - d} up to distance 1, then {@code e^-d}.
     * Used for content search so that sparse collections still return their nearest, if distant, hits.
     */
    EXPONENTIAL_TAIL {
        @Override
        double scoreFinite(double distance) {
            return distance <= 1.0d ? 1.0d - distance : Math.exp(-distance);
        }
    },

    /**
     * {@code 1 - min(d, 1)}. Used for integrity matching and FAQ search, where
     * anything past distance 1 is treated as unrelated.
     */
    LINEAR_CLAMP {
        @Override
        double scoreFinite(double distance) {
            return 1.0d - Math.min(distance, 1.0d);
        }
    };

    /**
     * @param distance raw distance; negative values (float noise) score 1, NaN scores 0
     */
    public double score(double distance) {
        if (Double.isNaN(distance)) {
            return 0.0d;
        }
        if (distance <= 0.0d) {
            return 1.0d;
        }
        if (Double.isInfinite(distance)) {
            return 0.0d;
        }
        return Math.max(0.0d, Math.min(1.0d, scoreFinite(distance)));
    }

    abstract double scoreFinite(double distance);
}
