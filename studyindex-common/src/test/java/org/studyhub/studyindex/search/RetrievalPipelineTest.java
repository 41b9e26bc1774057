package org.studyhub.studyindex.search;

import org.junit.jupiter.api.Test;
import org.studyhub.studyindex.client.RetrySettings;
import org.studyhub.studyindex.client.VectorStoreClient;
import org.studyhub.studyindex.model.Chunk;
import org.studyhub.studyindex.model.SearchResult;
import org.studyhub.studyindex.service.chunking.TextChunker;
import org.studyhub.studyindex.support.HashingEmbeddingProvider;
import org.studyhub.studyindex.support.InMemoryChromaApi;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Chunk, embed, store, search and rank end to end against the in-memory store.
 */
class RetrievalPipelineTest {

    private final HashingEmbeddingProvider embeddings = new HashingEmbeddingProvider();
    private final VectorStoreClient store =
            new VectorStoreClient(new InMemoryChromaApi(), new RetrySettings(3, 3, 7, Duration.ofMillis(1)));
    private final TextChunker chunker = new TextChunker();
    private final SearchRanker ranker = new SearchRanker();

    @Test
    void ingestedSentenceIsFoundByPartialQuery() {
        List<Chunk> chunks = chunker.chunk("Variables store data values in programming.", Map.of("parent", "CS101"));
        Chunk chunk = chunks.get(0);
        String id = chunk.documentId("CS101", "L1");
        store.addDocuments("course-content", List.of(id), List.of(chunk.getText()),
                List.of(chunk.getMetadata()), List.of(embeddings.embed(chunk.getText())));

        List<SearchResult> hits = ranker.toResults(
                store.search("course-content", embeddings.embed("store data"), 10, 0, null),
                ScoringPolicy.EXPONENTIAL_TAIL);
        List<SearchResult> ranked = ranker.rank(List.of(hits), 0.01, 10);

        assertTrue(ranked.stream().anyMatch(r -> r.getId().equals(id) && r.getRelevanceScore() > 0));
        assertTrue(ranked.stream().allMatch(r -> r.getRelevanceScore() <= 1.0));
    }
}
