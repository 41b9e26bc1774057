package org.studyhub.studyindex.indexer.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.studyhub.studyindex.client.VectorStoreClient;
import org.studyhub.studyindex.filter.Filter;
import org.studyhub.studyindex.indexer.config.RetrievalProperties;
import org.studyhub.studyindex.indexer.model.AssignmentDetail;
import org.studyhub.studyindex.indexer.model.AssignmentIndexRequest;
import org.studyhub.studyindex.indexer.model.AssignmentIndexRequest.Question;
import org.studyhub.studyindex.indexer.model.AssignmentSearchRequest;
import org.studyhub.studyindex.indexer.model.AssignmentSearchResponse;
import org.studyhub.studyindex.indexer.model.AssignmentSearchResponse.AssignmentHit;
import org.studyhub.studyindex.indexer.model.AssignmentSearchResponse.QuestionHit;
import org.studyhub.studyindex.indexer.model.AssignmentSummary;
import org.studyhub.studyindex.indexer.model.IntegrityCheckRequest;
import org.studyhub.studyindex.integrity.HighestMatch;
import org.studyhub.studyindex.integrity.IntegrityMatcher;
import org.studyhub.studyindex.integrity.IntegrityReport;
import org.studyhub.studyindex.model.ResultGroup;
import org.studyhub.studyindex.model.SearchResult;
import org.studyhub.studyindex.model.VectorQueryResult;
import org.studyhub.studyindex.search.ScoringPolicy;
import org.studyhub.studyindex.search.SearchRanker;
import org.studyhub.studyindex.service.EmbeddingProvider;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maintains the graded-assignment reference set and runs integrity checks against it.
 *
 * <p>Questions are stored whole, one document each, under {@code {assignmentId}_{questionId}_0}.
 * Besides submission checks, the reference set can be listed, read back per assignment and
 * searched with free text.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntegrityCheckService {

    public static final String QUESTION_TITLE_KEY = "question_title";
    public static final String QUESTION_TYPE_KEY = "question_type";
    public static final String INDEXED_AT_KEY = "indexed_at";

    private static final String MULTIPLE_CHOICE = "multiple_choice";
    private static final int TITLE_LIMIT = 100;
    private static final int EXCERPT_LENGTH = 200;

    private final VectorStoreClient vectorStoreClient;
    private final EmbeddingProvider embeddingProvider;
    private final IntegrityMatcher integrityMatcher;
    private final SemanticSearchService semanticSearchService;
    private final SearchRanker searchRanker;
    private final RetrievalProperties properties;

    /**
     * Replaces the reference questions of an assignment.
     *
     * @return number of questions stored
     */
    public int indexAssignment(AssignmentIndexRequest request) {
        String assignmentId = Identifiers.require(request.getAssignmentId(), "assignmentId");
        List<Question> questions = request.getQuestions();
        if (questions == null || questions.isEmpty()) {
            throw new IllegalArgumentException("Assignment must have at least one question");
        }

        deleteAssignment(assignmentId);

        String indexedAt = Instant.now().toString();
        List<String> ids = new ArrayList<>(questions.size());
        List<String> texts = new ArrayList<>(questions.size());
        List<Map<String, String>> metadatas = new ArrayList<>(questions.size());

        for (int i = 0; i < questions.size(); i++) {
            Question question = questions.get(i);
            String questionId = Identifiers.orDefault(question.getQuestionId(), "q" + (i + 1));

            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put(IntegrityMatcher.PARENT_KEY, assignmentId);
            metadata.put(IntegrityMatcher.QUESTION_KEY, questionId);
            metadata.put(IntegrityMatcher.COURSE_KEY, request.getCourseId());
            metadata.put(IntegrityMatcher.TITLE_KEY, truncate(request.getTitle()));
            metadata.put(QUESTION_TITLE_KEY, truncate(question.getTitle()));
            metadata.put(QUESTION_TYPE_KEY, question.getType());
            metadata.put(INDEXED_AT_KEY, indexedAt);

            ids.add(assignmentId + "_" + questionId + "_0");
            texts.add(questionText(question));
            metadatas.add(metadata);
        }

        vectorStoreClient.addDocuments(properties.getCollections().getGradedAssignments(),
                ids, texts, metadatas, embeddingProvider.embedAll(texts));

        log.info("Indexed assignment {} ({}) with {} questions", assignmentId, request.getTitle(), questions.size());
        return questions.size();
    }

    public void deleteAssignment(String assignmentId) {
        String id = Identifiers.require(assignmentId, "assignmentId");
        vectorStoreClient.deleteDocuments(properties.getCollections().getGradedAssignments(),
                null, Filter.eq(IntegrityMatcher.PARENT_KEY, id));
        log.info("Deleted assignment {}", id);
    }

    /**
     * Checks a submission; a missing threshold falls back to {@code retrieval.integrity.threshold}.
     */
    public IntegrityReport check(IntegrityCheckRequest request) {
        Double threshold = request.getThreshold() != null
                ? request.getThreshold()
                : properties.getIntegrity().getThreshold();
        return integrityMatcher.check(request.getSubmissionText(), request.getAssignmentIds(), threshold);
    }

    /**
     * Reads an assignment's reference questions back, in stored order.
     */
    public Optional<AssignmentDetail> getAssignment(String assignmentId) {
        String id = Identifiers.require(assignmentId, "assignmentId");
        VectorQueryResult documents = vectorStoreClient.getDocuments(properties.getCollections().getGradedAssignments(),
                Filter.eq(IntegrityMatcher.PARENT_KEY, id), null, null);
        if (documents.isEmpty()) {
            return Optional.empty();
        }

        Map<String, String> first = documents.metadata(0);
        AssignmentDetail detail = AssignmentDetail.builder()
                .assignmentId(id)
                .title(first.get(IntegrityMatcher.TITLE_KEY))
                .courseId(first.get(IntegrityMatcher.COURSE_KEY))
                .indexedAt(first.get(INDEXED_AT_KEY))
                .build();
        for (int i = 0; i < documents.size(); i++) {
            Map<String, String> metadata = documents.metadata(i);
            detail.getQuestions().add(new AssignmentDetail.StoredQuestion(
                    metadata.get(IntegrityMatcher.QUESTION_KEY),
                    metadata.get(QUESTION_TITLE_KEY),
                    metadata.get(QUESTION_TYPE_KEY),
                    documents.document(i)));
        }
        return Optional.of(detail);
    }

    /**
     * Every indexed assignment with its question count, ordered by assignment id.
     */
    public List<AssignmentSummary> getAllAssignments() {
        VectorQueryResult documents = vectorStoreClient.getDocuments(
                properties.getCollections().getGradedAssignments(), null, null, null);

        Map<String, AssignmentSummary> byAssignment = new LinkedHashMap<>();
        for (int i = 0; i < documents.size(); i++) {
            Map<String, String> metadata = documents.metadata(i);
            String assignmentId = metadata.get(IntegrityMatcher.PARENT_KEY);
            if (assignmentId == null || assignmentId.isBlank()) {
                continue;
            }
            AssignmentSummary summary = byAssignment.computeIfAbsent(assignmentId, key -> AssignmentSummary.builder()
                    .assignmentId(key)
                    .title(metadata.get(IntegrityMatcher.TITLE_KEY))
                    .courseId(metadata.get(IntegrityMatcher.COURSE_KEY))
                    .indexedAt(metadata.get(INDEXED_AT_KEY))
                    .build());
            summary.setQuestionCount(summary.getQuestionCount() + 1);
        }

        return byAssignment.values().stream()
                .sorted(Comparator.comparing(AssignmentSummary::getAssignmentId))
                .toList();
    }

    /**
     * Free-text search over the reference questions, grouped per assignment.
     *
     * <p>Questions scoring under the clamped threshold are dropped. Assignments are ranked by their
     * best question and list their matched questions best first. The response flags a potential
     * violation when the best match reaches {@code retrieval.integrity.threshold}.</p>
     */
    public AssignmentSearchResponse searchAssignments(AssignmentSearchRequest request) {
        long startTime = System.currentTimeMillis();
        String query = request.getQuery();
        if (query == null || query.isBlank()) {
            return AssignmentSearchResponse.empty(query);
        }

        RetrievalProperties.Integrity integrity = properties.getIntegrity();
        double threshold = integrity.resolveSearchThreshold(request.getThreshold());
        int limit = properties.getSearch().resolveLimit(request.getLimit());
        List<String> courseIds = request.getCourseIds();
        Filter filter = (courseIds == null || courseIds.isEmpty())
                ? null
                : Filter.anyOf(IntegrityMatcher.COURSE_KEY, courseIds);

        List<SearchResult> hits = semanticSearchService.search(properties.getCollections().getGradedAssignments(),
                        query.strip(), List.of(), filter, ScoringPolicy.LINEAR_CLAMP,
                        integrity.getSearchCandidates(), threshold)
                .stream()
                .filter(hit -> hit.metadataValue(IntegrityMatcher.PARENT_KEY) != null)
                .toList();

        List<AssignmentHit> assignments = new ArrayList<>();
        for (ResultGroup group : searchRanker.group(hits, IntegrityMatcher.PARENT_KEY, limit)) {
            assignments.add(toAssignmentHit(group));
        }

        HighestMatch highest = null;
        if (!hits.isEmpty()) {
            SearchResult best = hits.get(0);
            highest = new HighestMatch(best.metadataValue(IntegrityMatcher.PARENT_KEY),
                    best.metadataValue(IntegrityMatcher.QUESTION_KEY),
                    best.getId(),
                    best.getRelevanceScore(),
                    excerpt(best.getContent()));
        }

        log.info("Assignment search \"{}\" matched {} assignments (threshold={})", query, assignments.size(), threshold);
        return AssignmentSearchResponse.builder()
                .query(query)
                .total(assignments.size())
                .assignments(assignments)
                .highestMatch(highest)
                .potentialViolation(highest != null && highest.similarity() >= integrity.getThreshold())
                .searchTimeMs(System.currentTimeMillis() - startTime)
                .build();
    }

    private static AssignmentHit toAssignmentHit(ResultGroup group) {
        SearchResult top = group.children().get(0);
        Map<String, QuestionHit> questions = new LinkedHashMap<>();
        for (SearchResult child : group.children()) {
            String questionId = child.metadataValue(IntegrityMatcher.QUESTION_KEY);
            if (questionId != null) {
                questions.putIfAbsent(questionId, new QuestionHit(questionId,
                        child.metadataValue(QUESTION_TITLE_KEY), child.getContent(), child.getRelevanceScore()));
            }
        }
        return new AssignmentHit(group.parentId(),
                top.metadataValue(IntegrityMatcher.TITLE_KEY),
                top.metadataValue(IntegrityMatcher.COURSE_KEY),
                group.score(),
                new ArrayList<>(questions.values()));
    }

    private static String excerpt(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.strip();
        return trimmed.length() <= EXCERPT_LENGTH ? trimmed : trimmed.substring(0, EXCERPT_LENGTH) + "...";
    }

    static String questionText(Question question) {
        StringBuilder text = new StringBuilder("QUESTION: ")
                .append(question.getTitle() == null ? "" : question.getTitle())
                .append('\n')
                .append(question.getContent() == null ? "" : question.getContent());

        if (MULTIPLE_CHOICE.equals(question.getType()) && question.getOptions() != null) {
            List<String> options = question.getOptions();
            for (int i = 0; i < options.size(); i++) {
                text.append("\nOption ").append(i + 1).append(": ").append(options.get(i));
            }
        }
        return text.toString();
    }

    private static String truncate(String value) {
        if (value == null) {
            return null;
        }
        return value.length() <= TITLE_LIMIT ? value : value.substring(0, TITLE_LIMIT);
    }
}
