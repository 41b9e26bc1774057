package org.studyhub.studyindex.indexer.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.studyhub.studyindex.client.VectorStoreClient;
import org.studyhub.studyindex.exception.VectorStoreException;
import org.studyhub.studyindex.filter.Filter;
import org.studyhub.studyindex.model.CollectionStats;
import org.studyhub.studyindex.model.VectorQueryResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operational endpoints: collection inventory and store health.
 */
@Slf4j
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {

    private static final int MAX_PAGE = 100;

    private final VectorStoreClient vectorStoreClient;

    @GetMapping("/collections")
    public List<String> listCollections() {
        return vectorStoreClient.listCollections();
    }

    @GetMapping("/collections/{name}")
    public ResponseEntity<CollectionStats> getCollectionStats(@PathVariable String name) {
        return vectorStoreClient.getCollectionStats(name)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Pages through a collection's documents, optionally restricted to one metadata value.
     */
    @GetMapping("/collections/{name}/documents")
    public VectorQueryResult listDocuments(@PathVariable String name,
                                           @RequestParam(required = false) String field,
                                           @RequestParam(required = false) String value,
                                           @RequestParam(defaultValue = "20") int limit,
                                           @RequestParam(defaultValue = "0") int offset) {
        Filter filter = (field == null || value == null) ? null : Filter.eq(field, value);
        return vectorStoreClient.getDocuments(name, filter,
                Math.max(1, Math.min(limit, MAX_PAGE)), Math.max(0, offset));
    }

    @DeleteMapping("/collections/{name}")
    public ResponseEntity<Map<String, String>> deleteCollection(@PathVariable String name) {
        if (!vectorStoreClient.deleteCollection(name)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("status", "deleted", "collection", name));
    }

    /**
     * Heartbeats the store and reports the resulting connection state. Always answers 200.
     */
    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        try {
            vectorStoreClient.ensureConnection();
            health.put("status", "UP");
            health.put("storeReachable", true);
        } catch (VectorStoreException e) {
            log.error("Vector store health check failed: {}", e.getMessage());
            health.put("status", "DOWN");
            health.put("storeReachable", false);
            health.put("error", e.getMessage() != null ? e.getMessage() : "Unknown error");
        }
        health.put("connectionState", vectorStoreClient.getState());
        return health;
    }
}
