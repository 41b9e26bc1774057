package org.studyhub.studyindex.search;

/**
 * Knobs for query expansion.
 *
 * @param enabled          whether to expand at all
 * @param maxTerms         cap on returned expansion terms
 * @param explorationLimit hits harvested by the exploratory search when no scope is given
 */
public record ExpansionTuning(boolean enabled, int maxTerms, int explorationLimit) {

    public ExpansionTuning {
        if (maxTerms < 0) {
            throw new IllegalArgumentException("maxTerms must be >= 0");
        }
        if (explorationLimit < 1) {
            throw new IllegalArgumentException("explorationLimit must be >= 1");
        }
    }

    public static ExpansionTuning defaults() {
        return new ExpansionTuning(true, 8, 10);
    }

    public static ExpansionTuning disabled() {
        return new ExpansionTuning(false, 0, 1);
    }
}
