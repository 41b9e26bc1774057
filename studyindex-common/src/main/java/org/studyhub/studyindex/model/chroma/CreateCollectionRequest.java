package org.studyhub.studyindex.model.chroma;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CreateCollectionRequest {

    private String name;
    private Map<String, Object> metadata;

    @JsonProperty("get_or_create")
    private boolean getOrCreate;
}
