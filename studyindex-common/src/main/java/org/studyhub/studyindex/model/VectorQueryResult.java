package org.studyhub.studyindex.model;

import java.util.List;
import java.util.Map;

/**
 * Raw store hits as parallel lists. Position {@code i} of every list describes the same document.
 * {@code distances} is empty for fetches that are not similarity queries.
 */
public record VectorQueryResult(List<String> ids,
                                List<String> documents,
                                List<Map<String, String>> metadatas,
                                List<Double> distances) {

    public VectorQueryResult {
        ids = ids == null ? List.of() : ids;
        documents = documents == null ? List.of() : documents;
        metadatas = metadatas == null ? List.of() : metadatas;
        distances = distances == null ? List.of() : distances;
    }

    public static VectorQueryResult empty() {
        return new VectorQueryResult(List.of(), List.of(), List.of(), List.of());
    }

    public int size() {
        return ids.size();
    }

    public boolean isEmpty() {
        return ids.isEmpty();
    }

    public String document(int i) {
        return i < documents.size() ? documents.get(i) : null;
    }

    public Map<String, String> metadata(int i) {
        return i < metadatas.size() && metadatas.get(i) != null ? metadatas.get(i) : Map.of();
    }

    public Double distance(int i) {
        return i < distances.size() ? distances.get(i) : null;
    }
}
