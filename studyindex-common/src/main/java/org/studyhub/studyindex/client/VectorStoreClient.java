package org.studyhub.studyindex.client;

import lombok.extern.slf4j.Slf4j;
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
import org.studyhub.studyindex.model.chroma.AddRequest;
import org.studyhub.studyindex.model.chroma.ChromaCollection;
import org.studyhub.studyindex.model.chroma.CreateCollectionRequest;
import org.studyhub.studyindex.model.chroma.DeleteRequest;
import org.studyhub.studyindex.model.chroma.GetRequest;
import org.studyhub.studyindex.model.chroma.GetResponse;
import org.studyhub.studyindex.model.chroma.QueryRequest;
import org.studyhub.studyindex.model.chroma.QueryResponse;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import static java.lang.String.format;

/**
 * Resilient client for the vector store.
 *
 * <p>Owns the connection lifecycle ({@link ConnectionState}) and the collection handles,
 * and translates every HTTP failure into the {@code VectorStoreException} hierarchy.
 * One instance is shared by the whole process; all methods are safe to call concurrently.</p>
 *
 * <p>Retry budgets:</p>
 * <ul>
 *   <li>heartbeat: {@link RetrySettings#connectionAttempts()}, any failure</li>
 *   <li>collection lookup/creation and fetches: {@link RetrySettings#collectionAttempts()}, transport failures only</li>
 *   <li>similarity search: {@link RetrySettings#searchAttempts()}, forcing a fresh heartbeat before each retry</li>
 * </ul>
 */
@Slf4j
public class VectorStoreClient {

    public static final String META_DESCRIPTION = "description";
    public static final String META_VERSION = "version";
    public static final String META_CREATED_AT = "created_at";

    private static final String DEFAULT_VERSION = "1.0";
    private static final String DISTANCE_SPACE_KEY = "hnsw:space";
    private static final String DISTANCE_SPACE = "cosine";

    private final ChromaApi api;
    private final RetryPolicy connectionPolicy;
    private final RetryPolicy collectionPolicy;
    private final RetryPolicy searchPolicy;

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);
    private final Map<String, ChromaCollection> collections = new ConcurrentHashMap<>();

    public VectorStoreClient(ChromaApi api, RetrySettings settings) {
        this.api = api;
        this.connectionPolicy = new RetryPolicy("vector-store-heartbeat",
                settings.connectionAttempts(), settings.baseDelay(), failure -> true);
        this.collectionPolicy = new RetryPolicy("vector-store-collection",
                settings.collectionAttempts(), settings.baseDelay(), TransportFailures::isTransient);
        this.searchPolicy = new RetryPolicy("vector-store-search",
                settings.searchAttempts(), settings.baseDelay(),
                failure -> failure instanceof StoreConnectionException || TransportFailures.isTransient(failure));
    }

    public ConnectionState getState() {
        return state.get();
    }

    // ----------------------------------------------------------------------
    // Connection
    // ----------------------------------------------------------------------

    public void ensureConnection() {
        ensureConnection(false);
    }

    /**
     * Verifies the store is reachable.
     *
     * <p>Returns immediately when already connected unless {@code forceReconnect} is set.
     * Otherwise heartbeats under the connection policy, dropping cached collection handles
     * before every retry.</p>
     *
     * @throws StoreConnectionException once the heartbeat budget is exhausted
     */
    public void ensureConnection(boolean forceReconnect) {
        if (!forceReconnect && state.get() == ConnectionState.CONNECTED) {
            return;
        }
        if (forceReconnect) {
            reconnect();
        }
        try {
            connectionPolicy.run(this::heartbeat, this::reconnect);
        } catch (RuntimeException e) {
            state.set(ConnectionState.DISCONNECTED);
            throw new StoreConnectionException(format(
                    "Vector store unreachable after %d heartbeat attempts: %s",
                    connectionPolicy.maxAttempts(), e.getMessage()), e);
        }
    }

    private void heartbeat() {
        ConnectionState previous = state.getAndSet(ConnectionState.CONNECTING);
        try {
            api.heartbeat();
        } catch (RuntimeException e) {
            state.set(ConnectionState.DEGRADED);
            throw e;
        }
        state.set(ConnectionState.CONNECTED);
        if (previous != ConnectionState.CONNECTED) {
            log.info("Connected to vector store (previous state: {})", previous);
        }
    }

    private void reconnect() {
        state.set(ConnectionState.CONNECTING);
        collections.clear();
        log.debug("Dropped cached collection handles before reconnecting");
    }

    private void markDegraded(Throwable failure) {
        if (TransportFailures.isTransient(failure)
                && state.compareAndSet(ConnectionState.CONNECTED, ConnectionState.DEGRADED)) {
            log.warn("Vector store connection degraded: {}", failure.getMessage());
        }
    }

    // ----------------------------------------------------------------------
    // Collections
    // ----------------------------------------------------------------------

    /**
     * Returns the named collection, creating it when missing.
     *
     * <p>New collections get {@code description}, {@code version} and {@code created_at}
     * defaults, overridden by {@code metadata}. A concurrent creator winning the race is
     * resolved by fetching the collection it created.</p>
     *
     * @throws CollectionException when the collection can be neither fetched nor created
     */
    public ChromaCollection getOrCreateCollection(String name, Map<String, ?> metadata) {
        requireName(name);
        ChromaCollection cached = collections.get(name);
        if (cached != null) {
            return cached;
        }

        ensureConnection();
        try {
            ChromaCollection collection = collectionPolicy.execute(
                    () -> fetchOrCreate(name, metadata), this::ensureFreshConnection);
            collections.put(name, collection);
            return collection;
        } catch (CollectionException e) {
            throw e;
        } catch (RuntimeException e) {
            markDegraded(e);
            throw new CollectionException(format("Could not get or create collection '%s': %s",
                    name, e.getMessage()), e);
        }
    }

    private ChromaCollection fetchOrCreate(String name, Map<String, ?> metadata) {
        Optional<ChromaCollection> existing = fetchCollection(name);
        if (existing.isPresent()) {
            return existing.get();
        }

        Map<String, Object> merged = defaultMetadata(name);
        if (metadata != null) {
            metadata.forEach((key, value) -> {
                if (key != null && value != null) {
                    merged.put(key, value);
                }
            });
        }

        try {
            ChromaCollection created = api.createCollection(new CreateCollectionRequest(name, merged, false));
            log.info("Created collection '{}' (id={})", name, created.getId());
            return created;
        } catch (RestClientResponseException e) {
            if (!isAlreadyExists(e)) {
                throw e;
            }
            log.debug("Collection '{}' was created concurrently, fetching it", name);
            return fetchCollection(name).orElseThrow(() -> new CollectionException(
                    format("Collection '%s' reported as existing but could not be fetched", name), e));
        }
    }

    private Optional<ChromaCollection> fetchCollection(String name) {
        try {
            return Optional.ofNullable(api.getCollection(name));
        } catch (RestClientResponseException e) {
            if (isNotFound(e)) {
                return Optional.empty();
            }
            throw e;
        }
    }

    /**
     * Looks up an existing collection without creating it.
     */
    private Optional<ChromaCollection> resolveCollection(String name) {
        ChromaCollection cached = collections.get(name);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<ChromaCollection> fetched = fetchCollection(name);
        fetched.ifPresent(c -> collections.put(name, c));
        return fetched;
    }

    /**
     * Drops a collection and every document in it.
     *
     * @return {@code false} if the collection did not exist
     */
    public boolean deleteCollection(String name) {
        requireName(name);
        ensureConnection();
        try {
            collectionPolicy.run(() -> api.deleteCollection(name), this::ensureFreshConnection);
            log.info("Deleted collection '{}'", name);
            return true;
        } catch (RestClientResponseException e) {
            if (isNotFound(e)) {
                return false;
            }
            throw new CollectionException(format("Could not delete collection '%s': %s", name, e.getMessage()), e);
        } catch (RuntimeException e) {
            markDegraded(e);
            throw new CollectionException(format("Could not delete collection '%s': %s", name, e.getMessage()), e);
        } finally {
            collections.remove(name);
        }
    }

    public List<String> listCollections() {
        ensureConnection();
        try {
            List<ChromaCollection> all = collectionPolicy.execute(api::listCollections, this::ensureFreshConnection);
            if (all == null) {
                return List.of();
            }
            return all.stream().map(ChromaCollection::getName).toList();
        } catch (RuntimeException e) {
            markDegraded(e);
            throw new CollectionException("Could not list collections: " + e.getMessage(), e);
        }
    }

    /**
     * Document count and metadata of a collection, or empty if it does not exist.
     */
    public Optional<CollectionStats> getCollectionStats(String name) {
        requireName(name);
        ensureConnection();
        try {
            return collectionPolicy.execute(() -> resolveCollection(name).map(collection -> {
                Integer count = api.count(collection.getId());
                return new CollectionStats(collection.getName(), collection.getId(),
                        count == null ? 0 : count,
                        collection.getMetadata() == null ? Map.of() : collection.getMetadata());
            }), this::ensureFreshConnection);
        } catch (RuntimeException e) {
            markDegraded(e);
            throw new CollectionException(format("Could not read stats of collection '%s': %s",
                    name, e.getMessage()), e);
        }
    }

    // ----------------------------------------------------------------------
    // Documents
    // ----------------------------------------------------------------------

    /**
     * Stores new documents, creating the collection lazily.
     *
     * <p>Existing ids are handled by the backend; updates must delete first and re-insert.</p>
     *
     * @throws StorageException on mismatched input lengths or backend failure
     */
    public void addDocuments(String collection,
                             List<String> ids,
                             List<String> texts,
                             List<Map<String, String>> metadatas,
                             List<List<Double>> embeddings) {
        if (ids == null || ids.isEmpty()) {
            log.debug("No documents to store in '{}'", collection);
            return;
        }
        if (texts == null || metadatas == null || embeddings == null
                || texts.size() != ids.size() || metadatas.size() != ids.size() || embeddings.size() != ids.size()) {
            throw new StorageException(ErrorCode.INVALID_DOCUMENTS, format(
                    "ids, texts, metadatas and embeddings must have the same length (ids=%d, texts=%s, metadatas=%s, embeddings=%s)",
                    ids.size(), sizeOf(texts), sizeOf(metadatas), sizeOf(embeddings)));
        }

        ChromaCollection target = getOrCreateCollection(collection, Map.of());

        List<Map<String, String>> cleaned = new ArrayList<>(metadatas.size());
        for (Map<String, String> metadata : metadatas) {
            cleaned.add(cleanMetadata(metadata));
        }

        try {
            api.add(target.getId(), AddRequest.builder()
                    .ids(ids)
                    .documents(texts)
                    .metadatas(cleaned)
                    .embeddings(embeddings)
                    .build());
            log.debug("Stored {} documents in '{}'", ids.size(), collection);
        } catch (RuntimeException e) {
            markDegraded(e);
            throw new StorageException(format("Failed to store %d documents in '%s': %s",
                    ids.size(), collection, e.getMessage()), e);
        }
    }

    /**
     * Nearest-neighbour query.
     *
     * <p>{@code offset} is applied client-side by requesting {@code nResults + offset}
     * hits and skipping the first {@code offset}. A missing collection yields no hits.</p>
     *
     * @param filter optional metadata predicate, may be {@code null}
     * @throws SearchException when the query fails logically or its retry budget runs out
     */
    public VectorQueryResult search(String collection,
                                    List<Double> queryEmbedding,
                                    int nResults,
                                    int offset,
                                    Filter filter) {
        requireName(collection);
        if (queryEmbedding == null || queryEmbedding.isEmpty()) {
            throw new IllegalArgumentException("query embedding must not be empty");
        }
        if (nResults < 1 || offset < 0) {
            throw new IllegalArgumentException(format("invalid paging: nResults=%d offset=%d", nResults, offset));
        }

        QueryRequest request = QueryRequest.builder()
                .queryEmbeddings(List.of(queryEmbedding))
                .nResults(nResults + offset)
                .where(filter == null ? null : filter.toWhere())
                .include(QueryRequest.INCLUDE_ALL)
                .build();

        try {
            return searchPolicy.execute(() -> {
                ensureConnection();
                return query(collection, request, offset, nResults);
            }, () -> ensureConnection(true));
        } catch (RuntimeException e) {
            markDegraded(e);
            throw new SearchException(format("Search in '%s' failed: %s", collection, e.getMessage()), e);
        }
    }

    private VectorQueryResult query(String collection, QueryRequest request, int offset, int limit) {
        Optional<ChromaCollection> target = resolveCollection(collection);
        if (target.isEmpty()) {
            log.debug("Collection '{}' does not exist, returning no hits", collection);
            return VectorQueryResult.empty();
        }
        try {
            QueryResponse response = api.query(target.get().getId(), request);
            return toQueryResult(response, offset, limit);
        } catch (RestClientResponseException e) {
            if (isNotFound(e)) {
                collections.remove(collection);
                return VectorQueryResult.empty();
            }
            throw e;
        }
    }

    /**
     * Fetches documents by id, in backend order. Ids that do not exist are skipped.
     */
    public VectorQueryResult getDocuments(String collection, List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return VectorQueryResult.empty();
        }
        return fetch(collection, GetRequest.builder()
                .ids(ids)
                .include(GetRequest.INCLUDE_CONTENT)
                .build());
    }

    /**
     * Fetches documents matching a metadata predicate.
     *
     * @param filter optional predicate, {@code null} for all documents
     * @param limit  optional page size
     * @param offset optional page start
     */
    public VectorQueryResult getDocuments(String collection, Filter filter, Integer limit, Integer offset) {
        return fetch(collection, GetRequest.builder()
                .where(filter == null ? null : filter.toWhere())
                .limit(limit)
                .offset(offset)
                .include(GetRequest.INCLUDE_CONTENT)
                .build());
    }

    private VectorQueryResult fetch(String collection, GetRequest request) {
        requireName(collection);
        ensureConnection();
        try {
            return collectionPolicy.execute(() -> {
                Optional<ChromaCollection> target = resolveCollection(collection);
                if (target.isEmpty()) {
                    return VectorQueryResult.empty();
                }
                return toQueryResult(api.get(target.get().getId(), request));
            }, this::ensureFreshConnection);
        } catch (RuntimeException e) {
            markDegraded(e);
            throw new SearchException(format("Fetching documents from '%s' failed: %s",
                    collection, e.getMessage()), e);
        }
    }

    /**
     * Deletes by explicit ids, by metadata predicate, or both (intersection).
     *
     * @throws DeleteException when neither ids nor filter is given, or the backend fails
     */
    public void deleteDocuments(String collection, List<String> ids, Filter filter) {
        requireName(collection);
        boolean hasIds = ids != null && !ids.isEmpty();
        if (!hasIds && filter == null) {
            throw new DeleteException(ErrorCode.INVALID_DELETE,
                    "Refusing to delete from '" + collection + "' without ids or filter");
        }

        ensureConnection();
        try {
            Optional<ChromaCollection> target = resolveCollection(collection);
            if (target.isEmpty()) {
                log.debug("Collection '{}' does not exist, nothing to delete", collection);
                return;
            }
            api.delete(target.get().getId(), new DeleteRequest(
                    hasIds ? ids : null,
                    filter == null ? null : filter.toWhere()));
            log.debug("Deleted documents from '{}' (ids={}, filter={})",
                    collection, hasIds ? ids.size() : 0, filter);
        } catch (RuntimeException e) {
            markDegraded(e);
            throw new DeleteException(format("Failed to delete documents from '%s': %s",
                    collection, e.getMessage()), e);
        }
    }

    // ----------------------------------------------------------------------
    // Helpers
    // ----------------------------------------------------------------------

    private void ensureFreshConnection() {
        ensureConnection(true);
    }

    private static Map<String, Object> defaultMetadata(String name) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(META_DESCRIPTION, "Collection " + name);
        metadata.put(META_VERSION, DEFAULT_VERSION);
        metadata.put(META_CREATED_AT, Instant.now().toString());
        metadata.put(DISTANCE_SPACE_KEY, DISTANCE_SPACE);
        return metadata;
    }

    private static Map<String, String> cleanMetadata(Map<String, String> metadata) {
        Map<String, String> cleaned = new LinkedHashMap<>();
        if (metadata != null) {
            metadata.forEach((key, value) -> {
                if (key != null && !key.isBlank() && value != null) {
                    cleaned.put(key, value);
                }
            });
        }
        return cleaned;
    }

    private static VectorQueryResult toQueryResult(QueryResponse response, int offset, int limit) {
        if (response == null) {
            return VectorQueryResult.empty();
        }
        List<String> ids = first(response.getIds());
        List<String> documents = first(response.getDocuments());
        List<Map<String, Object>> metadatas = first(response.getMetadatas());
        List<Double> distances = first(response.getDistances());

        int from = Math.min(offset, ids.size());
        int to = Math.min(from + limit, ids.size());

        List<String> pageIds = new ArrayList<>(to - from);
        List<String> pageDocs = new ArrayList<>(to - from);
        List<Map<String, String>> pageMeta = new ArrayList<>(to - from);
        List<Double> pageDistances = new ArrayList<>(to - from);
        for (int i = from; i < to; i++) {
            pageIds.add(ids.get(i));
            pageDocs.add(i < documents.size() ? documents.get(i) : null);
            pageMeta.add(i < metadatas.size() ? toStringMap(metadatas.get(i)) : Map.of());
            pageDistances.add(i < distances.size() ? distances.get(i) : null);
        }
        return new VectorQueryResult(pageIds, pageDocs, pageMeta, pageDistances);
    }

    private static VectorQueryResult toQueryResult(GetResponse response) {
        if (response == null || response.getIds() == null) {
            return VectorQueryResult.empty();
        }
        List<Map<String, String>> metadatas = new ArrayList<>();
        if (response.getMetadatas() != null) {
            for (Map<String, Object> metadata : response.getMetadatas()) {
                metadatas.add(toStringMap(metadata));
            }
        }
        return new VectorQueryResult(response.getIds(), response.getDocuments(), metadatas, List.of());
    }

    private static <T> List<T> first(List<List<T>> nested) {
        if (nested == null || nested.isEmpty() || nested.get(0) == null) {
            return List.of();
        }
        return nested.get(0);
    }

    private static Map<String, String> toStringMap(Map<String, Object> raw) {
        if (raw == null) {
            return Map.of();
        }
        Map<String, String> converted = new LinkedHashMap<>();
        raw.forEach((key, value) -> {
            if (value != null) {
                converted.put(key, String.valueOf(value));
            }
        });
        return converted;
    }

    private static boolean isNotFound(RestClientResponseException e) {
        if (e instanceof HttpClientErrorException.NotFound || e.getStatusCode().value() == 404) {
            return true;
        }
        String body = e.getResponseBodyAsString();
        return body.contains("does not exist") || body.contains("not found");
    }

    private static boolean isAlreadyExists(RestClientResponseException e) {
        if (e.getStatusCode().value() == 409) {
            return true;
        }
        return e.getResponseBodyAsString().contains("already exists");
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("collection name must not be blank");
        }
    }

    private static String sizeOf(List<?> list) {
        return list == null ? "null" : String.valueOf(list.size());
    }
}
