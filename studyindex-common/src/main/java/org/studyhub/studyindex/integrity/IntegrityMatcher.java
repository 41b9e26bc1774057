package org.studyhub.studyindex.integrity;

import lombok.extern.slf4j.Slf4j;
import org.studyhub.studyindex.client.VectorStoreClient;
import org.studyhub.studyindex.exception.VectorStoreException;
import org.studyhub.studyindex.filter.Filter;
import org.studyhub.studyindex.model.VectorQueryResult;
import org.studyhub.studyindex.search.ScoringPolicy;
import org.studyhub.studyindex.service.EmbeddingProvider;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compares a submission against indexed reference questions to surface likely reuse.
 *
 * <p>The submission is embedded whole, without chunking. Each reference hit is scored with
 * {@link ScoringPolicy#LINEAR_CLAMP}; hits under {@link #RECALL_FLOOR} are ignored. Surviving
 * hits are grouped per reference parent ({@code assignment_id}) and the report flags a
 * potential violation when the best similarity reaches the threshold.</p>
 */
@Slf4j
public class IntegrityMatcher {

    public static final double RECALL_FLOOR = 0.7d;
    public static final double DEFAULT_THRESHOLD = 0.8d;
    public static final int DEFAULT_RESULTS = 5;

    public static final String PARENT_KEY = "assignment_id";
    public static final String QUESTION_KEY = "question_id";
    public static final String TITLE_KEY = "assignment_title";
    public static final String COURSE_KEY = "course_id";

    private static final int EXCERPT_LENGTH = 200;
    private static final ScoringPolicy POLICY = ScoringPolicy.LINEAR_CLAMP;

    private final VectorStoreClient vectorStore;
    private final EmbeddingProvider embeddingProvider;
    private final String referenceCollection;
    private final int nResults;

    public IntegrityMatcher(VectorStoreClient vectorStore,
                            EmbeddingProvider embeddingProvider,
                            String referenceCollection) {
        this(vectorStore, embeddingProvider, referenceCollection, DEFAULT_RESULTS);
    }

    public IntegrityMatcher(VectorStoreClient vectorStore,
                            EmbeddingProvider embeddingProvider,
                            String referenceCollection,
                            int nResults) {
        if (nResults < 1) {
            throw new IllegalArgumentException("nResults must be >= 1");
        }
        this.vectorStore = vectorStore;
        this.embeddingProvider = embeddingProvider;
        this.referenceCollection = referenceCollection;
        this.nResults = nResults;
    }

    /**
     * Clamps a requested threshold to [0, 1]; {@code null} or NaN gives {@link #DEFAULT_THRESHOLD}.
     */
    public static double resolveThreshold(Double requested) {
        if (requested == null || requested.isNaN()) {
            return DEFAULT_THRESHOLD;
        }
        return Math.max(0.0d, Math.min(1.0d, requested));
    }

    /**
     * @param submissionText text to check; blank text short-circuits to a clean report
     * @param scopeIds       optional reference parent ids to compare against
     * @param threshold      violation threshold, see {@link #resolveThreshold(Double)}
     */
    public IntegrityReport check(String submissionText, Collection<String> scopeIds, Double threshold) {
        long start = System.currentTimeMillis();
        double effectiveThreshold = resolveThreshold(threshold);

        if (submissionText == null || submissionText.isBlank()) {
            log.debug("Empty submission, skipping integrity check");
            return IntegrityReport.noViolation(effectiveThreshold, 0);
        }

        List<Double> embedding = embeddingProvider.embed(submissionText);
        if (embedding.isEmpty()) {
            return IntegrityReport.noViolation(effectiveThreshold, System.currentTimeMillis() - start);
        }

        Filter scope = (scopeIds == null || scopeIds.isEmpty()) ? null : Filter.anyOf(PARENT_KEY, scopeIds);

        VectorQueryResult hits;
        try {
            hits = vectorStore.search(referenceCollection, embedding, nResults, 0, scope);
        } catch (VectorStoreException e) {
            log.warn("Integrity check treated as no match, reference search failed [{}]: {}",
                    e.getCode().code(), e.getMessage());
            return IntegrityReport.noViolation(effectiveThreshold, System.currentTimeMillis() - start);
        }

        String queryExcerpt = excerpt(submissionText);
        Map<String, ParentMatches> byParent = new LinkedHashMap<>();
        HighestMatch highest = null;

        for (int i = 0; i < hits.size(); i++) {
            Double distance = hits.distance(i);
            if (distance == null) {
                continue;
            }
            double similarity = POLICY.score(distance);
            if (similarity < RECALL_FLOOR) {
                continue;
            }

            String referenceId = hits.ids().get(i);
            Map<String, String> metadata = hits.metadata(i);
            String parentId = metadata.getOrDefault(PARENT_KEY, referenceId);
            String questionId = metadata.get(QUESTION_KEY);
            String referenceExcerpt = excerpt(hits.document(i));

            byParent.computeIfAbsent(parentId, id -> new ParentMatches(id, metadata.get(TITLE_KEY), metadata.get(COURSE_KEY)))
                    .add(new MatchSegment(queryExcerpt, referenceExcerpt, referenceId, questionId, similarity));

            if (highest == null || similarity > highest.similarity()) {
                highest = new HighestMatch(parentId, questionId, referenceId, similarity, referenceExcerpt);
            }
        }

        List<AssignmentMatch> matches = byParent.values().stream()
                .map(ParentMatches::toMatch)
                .sorted(Comparator.comparingDouble(AssignmentMatch::highestSimilarity).reversed())
                .toList();

        boolean violation = highest != null && highest.similarity() >= effectiveThreshold;
        long elapsed = System.currentTimeMillis() - start;

        log.info("Integrity check: {} hits, {} matched assignments, highest={}, violation={} in {}ms",
                hits.size(), matches.size(),
                highest == null ? "none" : String.format("%.3f", highest.similarity()),
                violation, elapsed);

        return new IntegrityReport(matches, highest, violation, matches.size(), effectiveThreshold, elapsed);
    }

    private static String excerpt(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.strip();
        return trimmed.length() <= EXCERPT_LENGTH ? trimmed : trimmed.substring(0, EXCERPT_LENGTH) + "...";
    }

    private static final class ParentMatches {

        private final String assignmentId;
        private final String title;
        private final String courseId;
        private final Set<String> questions = new LinkedHashSet<>();
        private final List<MatchSegment> segments = new ArrayList<>();
        private double best;

        ParentMatches(String assignmentId, String title, String courseId) {
            this.assignmentId = assignmentId;
            this.title = title;
            this.courseId = courseId;
        }

        void add(MatchSegment segment) {
            segments.add(segment);
            if (segment.questionId() != null) {
                questions.add(segment.questionId());
            }
            best = Math.max(best, segment.similarity());
        }

        AssignmentMatch toMatch() {
            List<MatchSegment> sorted = segments.stream()
                    .sorted(Comparator.comparingDouble(MatchSegment::similarity).reversed())
                    .toList();
            return new AssignmentMatch(assignmentId, title, courseId, best, List.copyOf(questions), sorted);
        }
    }
}
