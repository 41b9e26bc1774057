package org.studyhub.studyindex.indexer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request payload shared by the course, resource and FAQ search endpoints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchRequest {

    /** Free-text query. */
    private String query;

    /** Maximum number of results (default 10, max 50). */
    private Integer limit;

    /** Minimum relevance score (0.0 to 1.0). */
    private Double minScore;

    /** Optional parent ids restricting the search: courses, resources or FAQ topics. */
    private List<String> scopeIds;

    /** Owner of personal resources; required by the resource search. */
    private String userId;

    /** Turns acronym and synonym expansion off when {@code false}. */
    private Boolean expand;
}
