package org.studyhub.studyindex.integrity;

import java.util.List;

/**
 * Best matches against one reference parent (an assignment).
 *
 * @param assignmentId      reference parent id
 * @param assignmentTitle   parent title from metadata, may be {@code null}
 * @param courseId          owning course from metadata, may be {@code null}
 * @param highestSimilarity best similarity among {@code segments}
 * @param matchedQuestions  distinct matched sub-item ids, in match order
 * @param segments          matched segments, best first
 */
public record AssignmentMatch(String assignmentId,
                              String assignmentTitle,
                              String courseId,
                              double highestSimilarity,
                              List<String> matchedQuestions,
                              List<MatchSegment> segments) {
}
