package org.studyhub.studyindex.indexer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FaqRequest {

    private String topic;
    private String question;
    private String answer;
    private String createdBy;

    @Builder.Default
    private List<String> tags = new ArrayList<>();
}
