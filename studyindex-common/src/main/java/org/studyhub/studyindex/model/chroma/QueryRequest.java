package org.studyhub.studyindex.model.chroma;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryRequest {

    public static final List<String> INCLUDE_ALL = List.of("documents", "metadatas", "distances");

    @JsonProperty("query_embeddings")
    private List<List<Double>> queryEmbeddings;

    @JsonProperty("n_results")
    private int nResults;

    private Map<String, Object> where;

    private List<String> include;
}
