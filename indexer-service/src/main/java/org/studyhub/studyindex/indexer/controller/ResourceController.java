package org.studyhub.studyindex.indexer.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.studyhub.studyindex.indexer.model.IndexingJob;
import org.studyhub.studyindex.indexer.model.ResourceIndexRequest;
import org.studyhub.studyindex.indexer.model.SearchRequest;
import org.studyhub.studyindex.indexer.model.SearchResponse;
import org.studyhub.studyindex.indexer.service.IndexingJobService;
import org.studyhub.studyindex.indexer.service.PersonalResourceService;

import java.util.Map;

/**
 * REST controller for personal study resources.
 */
@Slf4j
@RestController
@RequestMapping("/api/resources")
@RequiredArgsConstructor
public class ResourceController {

    private final PersonalResourceService personalResourceService;
    private final IndexingJobService indexingJobService;

    @PostMapping
    public ResponseEntity<IndexingJob> indexResource(@RequestBody ResourceIndexRequest request) {
        return ResponseEntity.accepted().body(indexingJobService.startResourceIndexing(request));
    }

    @DeleteMapping("/{resourceId}")
    public Map<String, String> deleteResource(@PathVariable String resourceId) {
        personalResourceService.deleteResource(resourceId);
        return Map.of("status", "deleted", "resourceId", resourceId);
    }

    @PostMapping("/search")
    public ResponseEntity<SearchResponse> search(@RequestBody SearchRequest request) {
        if (request.getQuery() == null || request.getQuery().isBlank()) {
            return ResponseEntity.badRequest().body(SearchResponse.empty(""));
        }

        log.debug("Resource search request: query=\"{}\", user={}, scope={}",
                request.getQuery(), request.getUserId(), request.getScopeIds());

        return ResponseEntity.ok(personalResourceService.search(request));
    }
}
