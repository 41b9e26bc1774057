package org.studyhub.studyindex.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A ranked hit. {@code relevanceScore} is always within [0, 1].
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchResult {

    private String id;
    private String content;
    private Map<String, String> metadata;
    private double relevanceScore;

    public String metadataValue(String key) {
        return metadata == null ? null : metadata.get(key);
    }
}
