package org.studyhub.studyindex.indexer.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.studyhub.studyindex.indexer.model.AssignmentIndexRequest;
import org.studyhub.studyindex.indexer.model.CourseIndexRequest;
import org.studyhub.studyindex.indexer.model.IndexingJob;
import org.studyhub.studyindex.indexer.model.IndexingJob.JobKind;
import org.studyhub.studyindex.indexer.model.ResourceIndexRequest;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.IntSupplier;

/**
 * Runs indexing work asynchronously on the indexing executor and tracks each job's state.
 *
 * <p>Request identifiers are validated before a job is created, so malformed requests fail
 * fast instead of producing a failed job.</p>
 */
@Slf4j
@Service
public class IndexingJobService {

    private final CourseContentService courseContentService;
    private final PersonalResourceService personalResourceService;
    private final IntegrityCheckService integrityCheckService;
    private final Executor indexingExecutor;

    private final Map<String, IndexingJob> jobsById = new ConcurrentHashMap<>();

    /**
     * @param courseContentService    indexes courses and lectures
     * @param personalResourceService indexes personal resources
     * @param integrityCheckService   indexes graded assignments
     * @param indexingExecutor        bounded executor for asynchronous jobs
     */
    public IndexingJobService(
            CourseContentService courseContentService,
            PersonalResourceService personalResourceService,
            IntegrityCheckService integrityCheckService,
            @Qualifier("indexingExecutor") Executor indexingExecutor
    ) {
        this.courseContentService = courseContentService;
        this.personalResourceService = personalResourceService;
        this.integrityCheckService = integrityCheckService;
        this.indexingExecutor = indexingExecutor;
    }

    public IndexingJob startCourseIndexing(CourseIndexRequest request) {
        String courseId = Identifiers.require(request.getCourseId(), "courseId");
        return submit(JobKind.COURSE, courseId, () -> courseContentService.indexCourse(request));
    }

    public IndexingJob startResourceIndexing(ResourceIndexRequest request) {
        String resourceId = Identifiers.require(request.getResourceId(), "resourceId");
        Identifiers.require(request.getUserId(), "userId");
        return submit(JobKind.RESOURCE, resourceId, () -> personalResourceService.indexResource(request));
    }

    public IndexingJob startAssignmentIndexing(AssignmentIndexRequest request) {
        String assignmentId = Identifiers.require(request.getAssignmentId(), "assignmentId");
        if (request.getQuestions() == null || request.getQuestions().isEmpty()) {
            throw new IllegalArgumentException("Assignment must have at least one question");
        }
        return submit(JobKind.ASSIGNMENT, assignmentId, () -> integrityCheckService.indexAssignment(request));
    }

    /**
     * @return the job, or {@code null} if not found
     */
    public IndexingJob getJob(String jobId) {
        return jobsById.get(jobId);
    }

    public Map<String, IndexingJob> getAllJobs() {
        return jobsById;
    }

    private IndexingJob submit(JobKind kind, String targetId, IntSupplier work) {
        String jobId = UUID.randomUUID().toString();
        IndexingJob job = new IndexingJob(jobId, kind, targetId);
        jobsById.put(jobId, job);

        log.info("Starting {} indexing job {} for {}", kind, jobId, targetId);
        CompletableFuture.runAsync(() -> run(job, work), indexingExecutor);
        return job;
    }

    private void run(IndexingJob job, IntSupplier work) {
        try {
            job.addIndexed(work.getAsInt());
            job.complete();
            log.info("{} indexing job {} completed. Indexed: {}",
                    job.getKind(), job.getJobId(), job.getIndexedCountValue());
        } catch (Exception e) {
            log.error("{} indexing job {} failed for {}", job.getKind(), job.getJobId(), job.getTargetId(), e);
            job.incrementFailed();
            job.fail(e.getMessage());
        }
    }
}
