package org.studyhub.studyindex.integrity;

/**
 * One submission excerpt matched against one reference item.
 *
 * @param queryExcerpt     leading part of the submission
 * @param referenceExcerpt leading part of the matched reference text
 * @param referenceId      matched document id
 * @param questionId       sub-item (question) of the reference parent, may be {@code null}
 * @param similarity       similarity in [0, 1]
 */
public record MatchSegment(String queryExcerpt,
                           String referenceExcerpt,
                           String referenceId,
                           String questionId,
                           double similarity) {
}
