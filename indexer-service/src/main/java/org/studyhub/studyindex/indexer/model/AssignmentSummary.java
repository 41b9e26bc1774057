package org.studyhub.studyindex.indexer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One indexed assignment as listed by {@code GET /api/assignments}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssignmentSummary {
    private String assignmentId;
    private String title;
    private String courseId;
    private int questionCount;
    private String indexedAt;
}
