package org.studyhub.studyindex.indexer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IntegrityCheckRequest {

    private String submissionText;

    /** Assignment ids to compare against; all indexed assignments when empty. */
    private List<String> assignmentIds;

    /** Violation threshold, 0.8 when absent. */
    private Double threshold;
}
