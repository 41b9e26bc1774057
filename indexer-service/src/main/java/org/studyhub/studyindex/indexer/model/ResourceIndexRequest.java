package org.studyhub.studyindex.indexer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A student's personal study resource and its files.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceIndexRequest {

    private String resourceId;
    private String userId;
    private String title;

    @Builder.Default
    private List<ResourceFile> files = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResourceFile {

        private String fileId;
        private String name;

        /** {@code text}, {@code url} or {@code file}. */
        private String type;

        /** MIME type for {@code file} entries. */
        private String fileType;

        private String content;
    }
}
