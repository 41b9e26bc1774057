package org.studyhub.studyindex.indexer.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.studyhub.studyindex.client.VectorStoreClient;
import org.studyhub.studyindex.filter.Filter;
import org.studyhub.studyindex.indexer.config.RetrievalProperties;
import org.studyhub.studyindex.indexer.model.CourseIndexRequest;
import org.studyhub.studyindex.indexer.model.CourseIndexRequest.Lecture;
import org.studyhub.studyindex.indexer.model.SearchRequest;
import org.studyhub.studyindex.indexer.model.SearchResponse;
import org.studyhub.studyindex.model.ResultGroup;
import org.studyhub.studyindex.model.SearchResult;
import org.studyhub.studyindex.search.ExpansionMetadataCodec;
import org.studyhub.studyindex.search.QueryExpander;
import org.studyhub.studyindex.search.ScoringPolicy;
import org.studyhub.studyindex.search.SearchRanker;
import org.studyhub.studyindex.service.EmbeddingProvider;
import org.studyhub.studyindex.service.chunking.TextChunker;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Indexes courses and searches their lecture content.
 *
 * <p>Each course produces one overview entity (id = course id) in the courses collection
 * and {@code {courseId}_{lectureId}_{chunkIndex}} chunks in the content collection. Both
 * carry the course's acronym and synonym JSON so that query expansion can find it either
 * by scope or by exploration.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CourseContentService {

    public static final String COURSE_KEY = "course_id";
    public static final String LECTURE_KEY = "lecture_id";
    public static final String LECTURE_TITLE_KEY = "lecture_title";

    private static final int DESCRIPTION_LIMIT = 1000;

    private final VectorStoreClient vectorStoreClient;
    private final EmbeddingProvider embeddingProvider;
    private final TextChunker textChunker;
    private final ExpansionMetadataCodec expansionMetadataCodec;
    private final QueryExpander queryExpander;
    private final SearchRanker searchRanker;
    private final SemanticSearchService semanticSearchService;
    private final RetrievalProperties properties;

    /**
     * Replaces the course's overview and lecture chunks.
     *
     * @return number of documents stored, overview included
     */
    public int indexCourse(CourseIndexRequest request) {
        String courseId = Identifiers.require(request.getCourseId(), "courseId");
        RetrievalProperties.Collections collections = properties.getCollections();

        String acronyms = expansionMetadataCodec.encodeAcronyms(request.getAcronyms());
        String synonyms = expansionMetadataCodec.encodeSynonyms(request.getSynonyms());

        deleteCourse(courseId);

        String overview = overviewText(request);
        Map<String, String> overviewMetadata = new LinkedHashMap<>();
        overviewMetadata.put(COURSE_KEY, courseId);
        overviewMetadata.put("code", request.getCode());
        overviewMetadata.put("title", request.getTitle());
        overviewMetadata.put("department", request.getDepartment());
        overviewMetadata.put("description", truncate(request.getDescription()));
        overviewMetadata.put("lecture_count", String.valueOf(lectures(request).size()));
        overviewMetadata.put("updated_at", Instant.now().toString());
        overviewMetadata.put(ExpansionMetadataCodec.ACRONYMS_KEY, acronyms);
        overviewMetadata.put(ExpansionMetadataCodec.SYNONYMS_KEY, synonyms);

        vectorStoreClient.addDocuments(collections.getCourses(),
                List.of(courseId),
                List.of(overview),
                List.of(overviewMetadata),
                List.of(embeddingProvider.embed(overview)));

        int stored = 1;
        List<Lecture> lectures = lectures(request);
        for (int i = 0; i < lectures.size(); i++) {
            Lecture lecture = lectures.get(i);
            String lectureId = Identifiers.orDefault(lecture.getLectureId(), "lecture" + (i + 1));

            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put(COURSE_KEY, courseId);
            metadata.put(LECTURE_KEY, lectureId);
            metadata.put(LECTURE_TITLE_KEY, lecture.getTitle());
            metadata.put(ExpansionMetadataCodec.ACRONYMS_KEY, acronyms);
            metadata.put(ExpansionMetadataCodec.SYNONYMS_KEY, synonyms);

            stored += ChunkWriter.write(vectorStoreClient, embeddingProvider, collections.getCourseContent(),
                    textChunker.chunk(lecture.getContent(), metadata), courseId, lectureId);
        }

        log.info("Indexed course {} ({}) with {} lectures, {} documents",
                courseId, request.getTitle(), lectures.size(), stored);
        return stored;
    }

    /**
     * Removes the course overview and every chunk of every lecture.
     */
    public void deleteCourse(String courseId) {
        String id = Identifiers.require(courseId, "courseId");
        RetrievalProperties.Collections collections = properties.getCollections();

        vectorStoreClient.deleteDocuments(collections.getCourses(), List.of(id), null);
        vectorStoreClient.deleteDocuments(collections.getCourseContent(), null, Filter.eq(COURSE_KEY, id));
        log.info("Deleted course {}", id);
    }

    /**
     * Expanded search over course overviews and lecture chunks, grouped per course.
     */
    public SearchResponse search(SearchRequest request) {
        long startTime = System.currentTimeMillis();
        RetrievalProperties.Search search = properties.getSearch();
        int limit = search.resolveLimit(request.getLimit());
        double minScore = search.resolveMinScore(request.getMinScore());
        List<String> scopeIds = request.getScopeIds();

        Filter scope = (scopeIds == null || scopeIds.isEmpty()) ? null : Filter.anyOf(COURSE_KEY, scopeIds);
        Set<String> terms = queryExpander.expand(request.getQuery(), scopeIds,
                properties.getExpansion().toTuning(request.getExpand()));

        RetrievalProperties.Collections collections = properties.getCollections();
        List<SearchResult> results = semanticSearchService.search(
                List.of(collections.getCourses(), collections.getCourseContent()),
                request.getQuery(), terms, scope, ScoringPolicy.EXPONENTIAL_TAIL, limit, minScore);
        List<ResultGroup> groups = searchRanker.group(results, COURSE_KEY, limit);

        return SearchResponse.builder()
                .query(request.getQuery())
                .expansionTerms(terms)
                .results(results)
                .groups(groups)
                .resultCount(results.size())
                .searchTimeMs(System.currentTimeMillis() - startTime)
                .build();
    }

    private static String overviewText(CourseIndexRequest request) {
        StringBuilder text = new StringBuilder();
        text.append("COURSE: ").append(nullToEmpty(request.getTitle())).append('\n');
        if (request.getCode() != null) {
            text.append("CODE: ").append(request.getCode()).append('\n');
        }
        text.append("DESCRIPTION: ").append(nullToEmpty(request.getDescription()));

        List<String> titles = new ArrayList<>();
        for (Lecture lecture : lectures(request)) {
            if (lecture.getTitle() != null && !lecture.getTitle().isBlank()) {
                titles.add(lecture.getTitle());
            }
        }
        if (!titles.isEmpty()) {
            text.append("\nLECTURES: ").append(String.join(" | ", titles));
        }
        return text.toString();
    }

    private static List<Lecture> lectures(CourseIndexRequest request) {
        return request.getLectures() == null ? List.of() : request.getLectures();
    }

    private static String truncate(String description) {
        if (description == null) {
            return null;
        }
        return description.length() <= DESCRIPTION_LIMIT ? description : description.substring(0, DESCRIPTION_LIMIT);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
