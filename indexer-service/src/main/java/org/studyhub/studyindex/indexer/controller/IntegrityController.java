package org.studyhub.studyindex.indexer.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.studyhub.studyindex.indexer.model.AssignmentDetail;
import org.studyhub.studyindex.indexer.model.AssignmentIndexRequest;
import org.studyhub.studyindex.indexer.model.AssignmentSearchRequest;
import org.studyhub.studyindex.indexer.model.AssignmentSearchResponse;
import org.studyhub.studyindex.indexer.model.AssignmentSummary;
import org.studyhub.studyindex.indexer.model.IndexingJob;
import org.studyhub.studyindex.indexer.model.IntegrityCheckRequest;
import org.studyhub.studyindex.indexer.service.IndexingJobService;
import org.studyhub.studyindex.indexer.service.IntegrityCheckService;
import org.studyhub.studyindex.integrity.IntegrityReport;

import java.util.List;
import java.util.Map;

/**
 * REST controller for the graded-assignment reference set and integrity checks.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class IntegrityController {

    private final IntegrityCheckService integrityCheckService;
    private final IndexingJobService indexingJobService;

    @PostMapping("/assignments")
    public ResponseEntity<IndexingJob> indexAssignment(@RequestBody AssignmentIndexRequest request) {
        return ResponseEntity.accepted().body(indexingJobService.startAssignmentIndexing(request));
    }

    @GetMapping("/assignments")
    public Map<String, Object> listAssignments() {
        List<AssignmentSummary> assignments = integrityCheckService.getAllAssignments();
        return Map.of("assignments", assignments, "total", assignments.size());
    }

    @GetMapping("/assignments/{assignmentId}")
    public ResponseEntity<AssignmentDetail> getAssignment(@PathVariable String assignmentId) {
        return integrityCheckService.getAssignment(assignmentId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/assignments/search")
    public ResponseEntity<AssignmentSearchResponse> searchAssignments(@RequestBody AssignmentSearchRequest request) {
        if (request.getQuery() == null || request.getQuery().isBlank()) {
            return ResponseEntity.badRequest().body(AssignmentSearchResponse.empty(""));
        }

        log.debug("Assignment search request: query=\"{}\", courses={}", request.getQuery(), request.getCourseIds());
        return ResponseEntity.ok(integrityCheckService.searchAssignments(request));
    }

    @DeleteMapping("/assignments/{assignmentId}")
    public Map<String, String> deleteAssignment(@PathVariable String assignmentId) {
        integrityCheckService.deleteAssignment(assignmentId);
        return Map.of("status", "deleted", "assignmentId", assignmentId);
    }

    /**
     * Compares a submission against the indexed questions. Blank submissions yield a clean report.
     */
    @PostMapping("/integrity/check")
    public IntegrityReport check(@RequestBody IntegrityCheckRequest request) {
        return integrityCheckService.check(request);
    }
}
