package org.studyhub.studyindex.indexer.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.studyhub.studyindex.indexer.model.IndexingJob;
import org.studyhub.studyindex.indexer.service.IndexingJobService;

import java.util.Map;

@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
public class JobController {

    private final IndexingJobService indexingJobService;

    @GetMapping("/{jobId}")
    public ResponseEntity<IndexingJob> getJob(@PathVariable String jobId) {
        IndexingJob job = indexingJobService.getJob(jobId);
        return job == null ? ResponseEntity.notFound().build() : ResponseEntity.ok(job);
    }

    @GetMapping
    public Map<String, IndexingJob> getAllJobs() {
        return indexingJobService.getAllJobs();
    }
}
