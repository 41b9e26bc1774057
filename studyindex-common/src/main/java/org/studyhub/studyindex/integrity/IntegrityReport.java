package org.studyhub.studyindex.integrity;

import java.util.List;

/**
 * Outcome of comparing one submission against the reference collection.
 *
 * @param matches            matches per reference parent, best first
 * @param highestMatch       strongest match, {@code null} when nothing matched
 * @param potentialViolation whether the strongest match reached the threshold
 * @param totalMatches       number of distinct matched parents
 * @param threshold          threshold that was applied
 * @param checkTimeMs        wall time of the check
 */
public record IntegrityReport(List<AssignmentMatch> matches,
                              HighestMatch highestMatch,
                              boolean potentialViolation,
                              int totalMatches,
                              double threshold,
                              long checkTimeMs) {

    public static IntegrityReport noViolation(double threshold, long checkTimeMs) {
        return new IntegrityReport(List.of(), null, false, 0, threshold, checkTimeMs);
    }
}
