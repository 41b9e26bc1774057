package org.studyhub.studyindex.model.chroma;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GetResponse {

    private List<String> ids;
    private List<String> documents;
    private List<Map<String, Object>> metadatas;
}
