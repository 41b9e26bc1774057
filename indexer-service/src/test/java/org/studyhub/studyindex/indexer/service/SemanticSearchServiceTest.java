package org.studyhub.studyindex.indexer.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.studyhub.studyindex.client.VectorStoreClient;
import org.studyhub.studyindex.exception.EmbeddingException;
import org.studyhub.studyindex.exception.SearchException;
import org.studyhub.studyindex.model.SearchResult;
import org.studyhub.studyindex.model.VectorQueryResult;
import org.studyhub.studyindex.search.ScoringPolicy;
import org.studyhub.studyindex.search.SearchRanker;
import org.studyhub.studyindex.service.EmbeddingProvider;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SemanticSearchServiceTest {

    private static final List<Double> BASE_VECTOR = List.of(1.0, 0.0);
    private static final List<Double> EXPANDED_VECTOR = List.of(0.0, 1.0);

    private final EmbeddingProvider embeddings =
            text -> text.equals("what is oop") ? BASE_VECTOR : EXPANDED_VECTOR;

    private VectorStoreClient store;
    private SemanticSearchService service;

    @BeforeEach
    void setUp() {
        store = mock(VectorStoreClient.class);
        service = new SemanticSearchService(store, embeddings, new SearchRanker());
    }

    @Test
    void failingStoreAnswersWithNoMatches() {
        when(store.search(any(), anyList(), anyInt(), anyInt(), any()))
                .thenThrow(new SearchException("boom", null));

        List<SearchResult> results = service.search("course-content", "what is oop",
                Set.of("object oriented programming"), null, ScoringPolicy.EXPONENTIAL_TAIL, 10, 0.01);

        assertTrue(results.isEmpty());
        verify(store, times(2)).search(eq("course-content"), anyList(), eq(10), eq(0), any());
    }

    @Test
    void failedExpansionVariantKeepsTheOtherVariantsHits() {
        when(store.search(eq("course-content"), eq(BASE_VECTOR), anyInt(), anyInt(), any()))
                .thenReturn(new VectorQueryResult(
                        List.of("CS101_L2_0"),
                        List.of("Classes bundle state."),
                        List.of(Map.of("course_id", "CS101")),
                        List.of(0.3)));
        when(store.search(eq("course-content"), eq(EXPANDED_VECTOR), anyInt(), anyInt(), any()))
                .thenThrow(new SearchException("timeout", null));

        List<SearchResult> results = service.search("course-content", "what is oop",
                Set.of("object oriented programming"), null, ScoringPolicy.EXPONENTIAL_TAIL, 10, 0.01);

        assertEquals(1, results.size());
        assertEquals("CS101_L2_0", results.get(0).getId());
        assertEquals(0.7, results.get(0).getRelevanceScore(), 1e-9);
    }

    @Test
    void hitsFromSeveralCollectionsAreRankedTogether() {
        when(store.search(eq("courses"), anyList(), anyInt(), anyInt(), any()))
                .thenReturn(new VectorQueryResult(
                        List.of("CS101"),
                        List.of("COURSE: Intro to Programming"),
                        List.of(Map.of("course_id", "CS101")),
                        List.of(0.1)));
        when(store.search(eq("course-content"), anyList(), anyInt(), anyInt(), any()))
                .thenThrow(new SearchException("collection busy", null));

        List<SearchResult> results = service.search(List.of("courses", "course-content"), "what is oop",
                Set.of(), null, ScoringPolicy.EXPONENTIAL_TAIL, 10, 0.01);

        assertEquals(List.of("CS101"), results.stream().map(SearchResult::getId).toList());
        assertEquals(0.9, results.get(0).getRelevanceScore(), 1e-9);
    }

    @Test
    void embeddingFailurePropagates() {
        EmbeddingProvider broken = text -> {
            throw new EmbeddingException("model offline", null);
        };
        SemanticSearchService failing = new SemanticSearchService(store, broken, new SearchRanker());

        assertThrows(EmbeddingException.class, () -> failing.search("faqs", "exam dates",
                Set.of(), null, ScoringPolicy.LINEAR_CLAMP, 10, 0.01));
        verifyNoInteractions(store);
    }
}
