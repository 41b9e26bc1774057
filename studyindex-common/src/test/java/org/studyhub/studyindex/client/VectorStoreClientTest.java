package org.studyhub.studyindex.client;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.studyhub.studyindex.exception.CollectionException;
import org.studyhub.studyindex.exception.DeleteException;
import org.studyhub.studyindex.exception.ErrorCode;
import org.studyhub.studyindex.exception.SearchException;
import org.studyhub.studyindex.exception.StorageException;
import org.studyhub.studyindex.exception.StoreConnectionException;
import org.studyhub.studyindex.filter.Filter;
import org.studyhub.studyindex.model.CollectionStats;
import org.studyhub.studyindex.model.ConnectionState;
import org.studyhub.studyindex.model.VectorQueryResult;
import org.studyhub.studyindex.model.chroma.ChromaCollection;
import org.studyhub.studyindex.support.HashingEmbeddingProvider;
import org.studyhub.studyindex.support.InMemoryChromaApi;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VectorStoreClientTest {

    private static final RetrySettings FAST = new RetrySettings(3, 3, 7, Duration.ofMillis(1));

    private InMemoryChromaApi chroma;
    private VectorStoreClient client;
    private final HashingEmbeddingProvider embeddings = new HashingEmbeddingProvider();

    @BeforeEach
    void setUp() {
        chroma = new InMemoryChromaApi();
        client = new VectorStoreClient(chroma, FAST);
    }

    // ---- connection ----

    @Test
    void connectsOnThirdHeartbeatAfterTwoFailures() {
        chroma.failNextHeartbeats(2);

        client.ensureConnection();

        assertEquals(ConnectionState.CONNECTED, client.getState());
        assertEquals(3, chroma.heartbeatCalls());
    }

    @Test
    void surfacesRetryableConnectionErrorOnceHeartbeatBudgetIsSpent() {
        chroma.failNextHeartbeats(3);

        StoreConnectionException e = assertThrows(StoreConnectionException.class, client::ensureConnection);

        assertEquals(ErrorCode.CONNECTION_FAILED, e.getCode());
        assertTrue(e.isRetryable());
        assertEquals(ConnectionState.DISCONNECTED, client.getState());
        assertEquals(3, chroma.heartbeatCalls());
    }

    @Test
    void skipsHeartbeatWhenAlreadyConnectedUnlessForced() {
        client.ensureConnection();
        client.ensureConnection();
        assertEquals(1, chroma.heartbeatCalls());

        client.ensureConnection(true);
        assertEquals(2, chroma.heartbeatCalls());
    }

    // ---- collections ----

    @Test
    void createsMissingCollectionWithDefaultMetadataOverriddenByCaller() {
        ChromaCollection created = client.getOrCreateCollection("course-content",
                Map.of(VectorStoreClient.META_DESCRIPTION, "Lecture chunks"));

        assertNotNull(created.getId());
        Map<String, Object> metadata = chroma.collectionMetadata("course-content");
        assertEquals("Lecture chunks", metadata.get(VectorStoreClient.META_DESCRIPTION));
        assertEquals("1.0", metadata.get(VectorStoreClient.META_VERSION));
        assertNotNull(metadata.get(VectorStoreClient.META_CREATED_AT));
    }

    @Test
    void reusesCollectionHandleAfterFirstLookup() {
        ChromaCollection first = client.getOrCreateCollection("faq_collection", Map.of());
        ChromaCollection second = client.getOrCreateCollection("faq_collection", Map.of());

        assertEquals(first.getId(), second.getId());
        assertEquals(1, chroma.createCalls());
    }

    @Test
    void fallsBackToFetchWhenConcurrentCreatorWins() {
        chroma.loseNextCreationRace();

        ChromaCollection collection = client.getOrCreateCollection("graded-assignments", Map.of());

        assertEquals("graded-assignments", collection.getName());
        assertEquals("created elsewhere", collection.getMetadata().get("description"));
    }

    @Test
    void listsCollectionsAndReportsStats() {
        add("course-content", "CS101_L1_0", "Variables store data values in programming.", Map.of("course_id", "CS101"));
        client.getOrCreateCollection("faq_collection", Map.of());

        assertEquals(List.of("course-content", "faq_collection"), client.listCollections());

        CollectionStats stats = client.getCollectionStats("course-content").orElseThrow();
        assertEquals(1, stats.count());
        assertEquals("course-content", stats.name());
        assertTrue(client.getCollectionStats("missing").isEmpty());
    }

    @Test
    void deleteCollectionReportsWhetherItExisted() {
        client.getOrCreateCollection("personal-resources", Map.of());

        assertTrue(client.deleteCollection("personal-resources"));
        assertFalse(client.deleteCollection("personal-resources"));
    }

    // ---- documents ----

    @Test
    void rejectsMismatchedDocumentLists() {
        StorageException e = assertThrows(StorageException.class, () -> client.addDocuments("course-content",
                List.of("a", "b"), List.of("only one"), List.of(Map.of()), List.of(List.of(1d))));

        assertEquals(ErrorCode.INVALID_DOCUMENTS, e.getCode());
    }

    @Test
    void searchAppliesOffsetClientSide() {
        add("course-content", "CS101_L1_0", "data structures and algorithms", Map.of("course_id", "CS101"));
        add("course-content", "CS101_L1_1", "data structures", Map.of("course_id", "CS101"));
        add("course-content", "CS101_L2_0", "poetry of the renaissance", Map.of("course_id", "CS101"));

        List<Double> query = embeddings.embed("data structures");
        VectorQueryResult all = client.search("course-content", query, 3, 0, null);
        VectorQueryResult paged = client.search("course-content", query, 1, 1, null);

        assertEquals(3, all.size());
        assertEquals(List.of(all.ids().get(1)), paged.ids());
    }

    @Test
    void searchHonoursFilter() {
        add("course-content", "CS101_L1_0", "recursion basics", Map.of("course_id", "CS101"));
        add("course-content", "MA201_L1_0", "recursion in sequences", Map.of("course_id", "MA201"));

        VectorQueryResult result = client.search("course-content", embeddings.embed("recursion"), 5, 0,
                Filter.eq("course_id", "MA201"));

        assertEquals(List.of("MA201_L1_0"), result.ids());
        assertEquals("MA201", result.metadata(0).get("course_id"));
    }

    @Test
    void searchRetriesTransportFailuresWithFreshConnection() {
        add("course-content", "CS101_L1_0", "recursion basics", Map.of("course_id", "CS101"));
        int heartbeatsBefore = chroma.heartbeatCalls();
        chroma.failNextQueries(6);

        VectorQueryResult result = client.search("course-content", embeddings.embed("recursion"), 5, 0, null);

        assertEquals(1, result.size());
        assertEquals(7, chroma.queryCalls());
        assertTrue(chroma.heartbeatCalls() - heartbeatsBefore >= 6);
        assertEquals(ConnectionState.CONNECTED, client.getState());
    }

    @Test
    void searchSurfacesTypedErrorWhenRetryBudgetIsSpent() {
        add("course-content", "CS101_L1_0", "recursion basics", Map.of("course_id", "CS101"));
        chroma.failNextQueries(7);

        SearchException e = assertThrows(SearchException.class,
                () -> client.search("course-content", embeddings.embed("recursion"), 5, 0, null));

        assertEquals(ErrorCode.SEARCH_FAILED, e.getCode());
        assertEquals(7, chroma.queryCalls());
    }

    @Test
    void searchDoesNotRetryLogicalFailures() {
        add("course-content", "CS101_L1_0", "recursion basics", Map.of("course_id", "CS101"));
        chroma.failQueriesWith(new HttpClientErrorException(HttpStatus.BAD_REQUEST, "Invalid where clause"));

        assertThrows(SearchException.class,
                () -> client.search("course-content", embeddings.embed("recursion"), 5, 0, null));
        assertEquals(1, chroma.queryCalls());
    }

    @Test
    void searchOnMissingCollectionFindsNothing() {
        VectorQueryResult result = client.search("never-created", embeddings.embed("anything"), 5, 0, null);

        assertTrue(result.isEmpty());
    }

    @Test
    void fetchesDocumentsByIdAndByFilter() {
        add("courses", "CS101", "Intro to programming", Map.of("course_id", "CS101"));
        add("courses", "MA201", "Discrete maths", Map.of("course_id", "MA201"));

        assertEquals(List.of("MA201"), client.getDocuments("courses", List.of("MA201", "missing")).ids());
        assertEquals(List.of("CS101"), client.getDocuments("courses", Filter.eq("course_id", "CS101"), 10, 0).ids());
    }

    @Test
    void cascadeDeletesEveryChunkOfAParent() {
        add("course-content", "CS101_L1_0", "chunk zero", Map.of("course_id", "CS101"));
        add("course-content", "CS101_L1_1", "chunk one", Map.of("course_id", "CS101"));
        add("course-content", "MA201_L1_0", "other course", Map.of("course_id", "MA201"));

        client.deleteDocuments("course-content", null, Filter.eq("course_id", "CS101"));

        assertEquals(1, client.getCollectionStats("course-content").orElseThrow().count());
    }

    @Test
    void refusesUnboundedDelete() {
        DeleteException e = assertThrows(DeleteException.class,
                () -> client.deleteDocuments("course-content", List.of(), null));

        assertEquals(ErrorCode.INVALID_DELETE, e.getCode());
    }

    private void add(String collection, String id, String text, Map<String, String> metadata) {
        client.addDocuments(collection, List.of(id), List.of(text), List.of(metadata), List.of(embeddings.embed(text)));
    }
}
