package org.studyhub.studyindex.indexer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssignmentDetail {
    private String assignmentId;
    private String title;
    private String courseId;
    private String indexedAt;
    @Builder.Default
    private List<StoredQuestion> questions = new ArrayList<>();

    /**
     * A reference question as stored, {@code content} being the indexed text.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StoredQuestion {
        private String questionId;
        private String title;
        private String type;
        private String content;
    }
}
