package org.studyhub.studyindex.support;

import org.studyhub.studyindex.service.EmbeddingProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic bag-of-words embedding: identical texts embed identically and shared
 * words pull vectors together.
 */
public class HashingEmbeddingProvider implements EmbeddingProvider {

    private final int dimension;

    public HashingEmbeddingProvider() {
        this(256);
    }

    public HashingEmbeddingProvider(int dimension) {
        this.dimension = dimension;
    }

    @Override
    public List<Double> embed(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        double[] vector = new double[dimension];
        for (String token : text.toLowerCase(Locale.ROOT).split("\\W+")) {
            if (token.isBlank()) {
                continue;
            }
            vector[Math.floorMod(token.hashCode(), dimension)] += 1d;
        }

        double norm = 0d;
        for (double v : vector) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);

        List<Double> result = new ArrayList<>(dimension);
        for (double v : vector) {
            result.add(norm > 0d ? v / norm : 0d);
        }
        return result;
    }
}
