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
public class GetRequest {

    public static final List<String> INCLUDE_CONTENT = List.of("documents", "metadatas");

    private List<String> ids;
    private Map<String, Object> where;
    private Integer limit;
    private Integer offset;
    private List<String> include;
}
