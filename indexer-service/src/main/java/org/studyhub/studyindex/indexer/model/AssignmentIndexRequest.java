package org.studyhub.studyindex.indexer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A graded assignment whose questions become integrity references.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssignmentIndexRequest {

    private String assignmentId;
    private String courseId;
    private String title;

    @Builder.Default
    private List<Question> questions = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Question {
        private String questionId;
        private String title;
        private String content;
        private String type;
        private List<String> options;
    }
}
