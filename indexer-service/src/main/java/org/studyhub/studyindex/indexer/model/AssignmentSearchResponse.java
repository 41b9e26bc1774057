package org.studyhub.studyindex.indexer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.studyhub.studyindex.integrity.HighestMatch;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AssignmentSearchResponse {

    private String query;
    private int total;
    private long searchTimeMs;

    /** Assignments ranked by their best matching question. */
    private List<AssignmentHit> assignments;

    private HighestMatch highestMatch;

    /** Whether the best match reaches the integrity violation threshold. */
    private boolean potentialViolation;

    public static AssignmentSearchResponse empty(String query) {
        return AssignmentSearchResponse.builder()
                .query(query == null ? "" : query)
                .total(0)
                .assignments(List.of())
                .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AssignmentHit {
        private String assignmentId;
        private String title;
        private String courseId;
        private double highestSimilarity;
        private List<QuestionHit> matchedQuestions;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class QuestionHit {
        private String questionId;
        private String title;
        private String content;
        private double similarity;
    }
}
