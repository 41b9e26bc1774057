package org.studyhub.studyindex.indexer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.studyhub.studyindex.model.ResultGroup;
import org.studyhub.studyindex.model.SearchResult;

import java.util.List;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchResponse {

    private String query;
    private int resultCount;
    private long searchTimeMs;

    /** Terms added by query expansion, if any. */
    private Set<String> expansionTerms;

    private List<SearchResult> results;

    /** Results grouped by parent entity; only set by grouped searches. */
    private List<ResultGroup> groups;

    public static SearchResponse empty(String query) {
        return SearchResponse.builder()
                .query(query == null ? "" : query)
                .resultCount(0)
                .results(List.of())
                .build();
    }
}
