package org.studyhub.studyindex.indexer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Progress of one asynchronous indexing run.
 */
@Getter
@RequiredArgsConstructor
public class IndexingJob {

    public enum JobStatus { RUNNING, COMPLETED, FAILED }

    public enum JobKind { COURSE, RESOURCE, ASSIGNMENT }

    private final String jobId;
    private final JobKind kind;
    private final String targetId;

    private volatile JobStatus status = JobStatus.RUNNING;

    private final Instant startedAt = Instant.now();
    private volatile Instant completedAt;
    private volatile String error;

    @JsonIgnore
    private final AtomicInteger indexedCount = new AtomicInteger(0);

    @JsonIgnore
    private final AtomicInteger failedCount = new AtomicInteger(0);

    public void addIndexed(int count) {
        indexedCount.addAndGet(count);
    }

    public void incrementFailed() {
        failedCount.incrementAndGet();
    }

    public void complete() {
        status = JobStatus.COMPLETED;
        completedAt = Instant.now();
    }

    public void fail(String reason) {
        error = reason;
        status = JobStatus.FAILED;
        completedAt = Instant.now();
    }

    @JsonProperty("indexedCount")
    public int getIndexedCountValue() {
        return indexedCount.get();
    }

    @JsonProperty("failedCount")
    public int getFailedCountValue() {
        return failedCount.get();
    }
}
