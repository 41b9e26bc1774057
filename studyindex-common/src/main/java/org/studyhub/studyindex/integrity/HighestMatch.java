package org.studyhub.studyindex.integrity;

/**
 * The single strongest match across all reference parents.
 */
public record HighestMatch(String assignmentId,
                           String questionId,
                           String referenceId,
                           double similarity,
                           String referenceExcerpt) {
}
