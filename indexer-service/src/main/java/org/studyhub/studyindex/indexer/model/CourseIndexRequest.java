package org.studyhub.studyindex.indexer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A course to index: an overview entity plus its lecture texts.
 *
 * <p>{@code acronyms} and {@code synonyms} feed query expansion and are stored as JSON
 * metadata on the overview and on every lecture chunk.</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CourseIndexRequest {

    private String courseId;
    private String code;
    private String title;
    private String description;
    private String department;

    @Builder.Default
    private Map<String, String> acronyms = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, List<String>> synonyms = new LinkedHashMap<>();

    @Builder.Default
    private List<Lecture> lectures = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Lecture {
        private String lectureId;
        private String title;
        private String content;
    }
}
