package org.studyhub.studyindex.indexer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A stored FAQ item, read back from its document and metadata.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FaqEntry {
    private String faqId;
    private String topic;
    private String question;
    private String answer;
    private List<String> tags;
    private String createdBy;
    private String lastUpdated;
}
