package org.studyhub.studyindex.indexer.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.studyhub.studyindex.indexer.model.CourseIndexRequest;
import org.studyhub.studyindex.indexer.model.IndexingJob;
import org.studyhub.studyindex.indexer.model.SearchRequest;
import org.studyhub.studyindex.indexer.model.SearchResponse;
import org.studyhub.studyindex.indexer.service.CourseContentService;
import org.studyhub.studyindex.indexer.service.IndexingJobService;

import java.util.Map;

/**
 * REST controller for course indexing and course content search.
 */
@Slf4j
@RestController
@RequestMapping("/api/courses")
@RequiredArgsConstructor
public class CourseController {

    private final CourseContentService courseContentService;
    private final IndexingJobService indexingJobService;

    /**
     * Starts an asynchronous job that replaces the course's overview and lecture chunks.
     *
     * @return 202 with the created {@link IndexingJob}
     */
    @PostMapping
    public ResponseEntity<IndexingJob> indexCourse(@RequestBody CourseIndexRequest request) {
        return ResponseEntity.accepted().body(indexingJobService.startCourseIndexing(request));
    }

    @DeleteMapping("/{courseId}")
    public Map<String, String> deleteCourse(@PathVariable String courseId) {
        courseContentService.deleteCourse(courseId);
        return Map.of("status", "deleted", "courseId", courseId);
    }

    /**
     * Expanded search over lecture content, grouped per course.
     */
    @PostMapping("/search")
    public ResponseEntity<SearchResponse> search(@RequestBody SearchRequest request) {
        if (request.getQuery() == null || request.getQuery().isBlank()) {
            return ResponseEntity.badRequest().body(SearchResponse.empty(""));
        }

        log.debug("Course search request: query=\"{}\", limit={}, minScore={}, scope={}",
                request.getQuery(), request.getLimit(), request.getMinScore(), request.getScopeIds());

        return ResponseEntity.ok(courseContentService.search(request));
    }
}
