package org.studyhub.studyindex.model.chroma;

import com.fasterxml.jackson.annotation.JsonInclude;
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
public class AddRequest {

    private List<String> ids;
    private List<List<Double>> embeddings;
    private List<Map<String, String>> metadatas;
    private List<String> documents;
}
