package org.studyhub.studyindex.client;

import org.studyhub.studyindex.model.chroma.AddRequest;
import org.studyhub.studyindex.model.chroma.ChromaCollection;
import org.studyhub.studyindex.model.chroma.CreateCollectionRequest;
import org.studyhub.studyindex.model.chroma.DeleteRequest;
import org.studyhub.studyindex.model.chroma.GetRequest;
import org.studyhub.studyindex.model.chroma.GetResponse;
import org.studyhub.studyindex.model.chroma.QueryRequest;
import org.studyhub.studyindex.model.chroma.QueryResponse;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.service.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Spring HTTP Interface for the Chroma REST API (v1).
 * <p>
 * Collection lookups, creation and drops are addressed by name; document operations
 * are addressed by the collection's server-side id. Retry and error translation live
 * in {@link VectorStoreClient}.
 */
@HttpExchange("/api/v1")
public interface ChromaApi {

    @GetExchange("/heartbeat")
    Map<String, Object> heartbeat();

    @GetExchange("/collections")
    List<ChromaCollection> listCollections();

    @GetExchange("/collections/{name}")
    ChromaCollection getCollection(@PathVariable String name);

    @PostExchange("/collections")
    ChromaCollection createCollection(@RequestBody CreateCollectionRequest request);

    @DeleteExchange("/collections/{name}")
    void deleteCollection(@PathVariable String name);

    @PostExchange("/collections/{collectionId}/add")
    void add(@PathVariable String collectionId, @RequestBody AddRequest request);

    @PostExchange("/collections/{collectionId}/query")
    QueryResponse query(@PathVariable String collectionId, @RequestBody QueryRequest request);

    @PostExchange("/collections/{collectionId}/get")
    GetResponse get(@PathVariable String collectionId, @RequestBody GetRequest request);

    @PostExchange("/collections/{collectionId}/delete")
    void delete(@PathVariable String collectionId, @RequestBody DeleteRequest request);

    @GetExchange("/collections/{collectionId}/count")
    Integer count(@PathVariable String collectionId);
}
