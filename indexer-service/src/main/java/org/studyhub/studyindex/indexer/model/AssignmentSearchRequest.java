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
public class AssignmentSearchRequest {

    private String query;

    /** Restricts the search to these courses when not empty. */
    private List<String> courseIds;

    /** Minimum question similarity, clamped to [0, 1]; {@code retrieval.integrity.search-threshold} when absent. */
    private Double threshold;

    /** Maximum number of assignments returned. */
    private Integer limit;
}
