package org.studyhub.studyindex.service;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns text into an embedding vector. Documents and queries must be embedded by the same provider.
 */
public interface EmbeddingProvider {

    /**
     * @param text text to embed
     * @return embedding vector, empty for blank text
     * @throws org.studyhub.studyindex.exception.EmbeddingException if the model cannot produce a vector
     */
    List<Double> embed(String text);

    /**
     * Embeds every text in order; blank entries yield empty vectors.
     */
    default List<List<Double>> embedAll(List<String> texts) {
        List<List<Double>> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }
}
