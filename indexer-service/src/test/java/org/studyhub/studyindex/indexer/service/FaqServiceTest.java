package org.studyhub.studyindex.indexer.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.studyhub.studyindex.client.VectorStoreClient;
import org.studyhub.studyindex.filter.Filter;
import org.studyhub.studyindex.indexer.config.RetrievalProperties;
import org.studyhub.studyindex.indexer.model.FaqEntry;
import org.studyhub.studyindex.indexer.model.SearchRequest;
import org.studyhub.studyindex.model.VectorQueryResult;
import org.studyhub.studyindex.search.SearchRanker;
import org.studyhub.studyindex.service.EmbeddingProvider;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class FaqServiceTest {

    private final EmbeddingProvider embeddings = text -> List.of(0.3, 0.7);

    private VectorStoreClient store;
    private FaqService service;

    @BeforeEach
    void setUp() {
        store = mock(VectorStoreClient.class);
        SearchRanker ranker = new SearchRanker();
        service = new FaqService(store, embeddings, new SemanticSearchService(store, embeddings, ranker),
                new RetrievalProperties());
    }

    @Test
    void storedFaqIsReadBackById() {
        when(store.getDocuments("faq_collection", List.of("faq_1"))).thenReturn(new VectorQueryResult(
                List.of("faq_1"),
                List.of("TOPIC: Exams\nQUESTION: When is the final?\nANSWER: Week 15.\nBring your student card."),
                List.of(Map.of(
                        "faq_id", "faq_1",
                        "topic", "Exams",
                        "question", "When is the final?",
                        "tags", "exams,schedule",
                        "created_by", "registrar",
                        "last_updated", "2026-01-10T09:00:00Z")),
                List.of()));

        Optional<FaqEntry> faq = service.getFaq("faq_1");

        assertTrue(faq.isPresent());
        assertEquals("Exams", faq.get().getTopic());
        assertEquals("When is the final?", faq.get().getQuestion());
        assertEquals("Week 15.\nBring your student card.", faq.get().getAnswer());
        assertEquals(List.of("exams", "schedule"), faq.get().getTags());
        assertEquals("registrar", faq.get().getCreatedBy());
    }

    @Test
    void unknownFaqIsAbsent() {
        when(store.getDocuments(eq("faq_collection"), anyList())).thenReturn(VectorQueryResult.empty());

        assertTrue(service.getFaq("faq_missing").isEmpty());
    }

    @Test
    void nullAndBlankTopicsAreIgnoredInTheScope() {
        when(store.search(any(), anyList(), anyInt(), anyInt(), any())).thenReturn(VectorQueryResult.empty());

        service.search(SearchRequest.builder()
                .query("exam dates")
                .scopeIds(Arrays.asList("Exams", null, " "))
                .build());

        ArgumentCaptor<Filter> filter = ArgumentCaptor.forClass(Filter.class);
        verify(store).search(eq("faq_collection"), anyList(), eq(10), eq(0), filter.capture());
        assertEquals(Map.of("topic", Map.of("$eq", "Exams")), filter.getValue().toWhere());
    }

    @Test
    void scopeWithOnlyBlankTopicsIsRejected() {
        SearchRequest request = SearchRequest.builder()
                .query("exam dates")
                .scopeIds(Arrays.asList(" ", null))
                .build();

        assertThrows(IllegalArgumentException.class, () -> service.search(request));
        verifyNoInteractions(store);
    }
}
