package org.studyhub.studyindex.service;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.studyhub.studyindex.exception.EmbeddingException;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingRequest;
import org.springframework.ai.embedding.EmbeddingResponse;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link EmbeddingProvider} backed by a Spring AI {@link EmbeddingModel}.
 *
 * <p>Input is sanitized and capped before it reaches the model. Model failures are not
 * retried: they surface immediately as {@link EmbeddingException}, since a model that
 * cannot embed usually means a misconfigured deployment.</p>
 */
@Slf4j
public class EmbeddingService implements EmbeddingProvider {

    // Safety cap for pathological inputs (e.g., malformed text, binary garbage)
    // This should rarely trigger if chunking is working correctly
    private static final int SAFETY_CAP = 8000;

    private final EmbeddingModel embeddingModel;

    @Getter
    private final String modelName;

    public EmbeddingService(EmbeddingModel embeddingModel, String modelName) {
        this.embeddingModel = embeddingModel;
        this.modelName = modelName;
    }

    @Override
    public List<Double> embed(String text) {
        if (text == null) {
            return List.of();
        }
        String sanitized = sanitize(text);
        if (sanitized.isBlank()) {
            return List.of();
        }

        if (sanitized.length() > SAFETY_CAP) {
            log.warn("Embedding input exceeds SAFETY_CAP ({} > {}), truncating", sanitized.length(), SAFETY_CAP);
            sanitized = sanitized.substring(0, SAFETY_CAP);
        }

        EmbeddingResponse response;
        try {
            response = embeddingModel.call(new EmbeddingRequest(List.of(sanitized), null));
        } catch (RuntimeException e) {
            throw new EmbeddingException("Embedding model " + modelName + " failed: " + e.getMessage(), e);
        }

        if (response == null || response.getResults() == null || response.getResults().isEmpty()
                || response.getResults().get(0).getOutput() == null
                || response.getResults().get(0).getOutput().length == 0) {
            throw new EmbeddingException("Embedding model " + modelName + " returned no vector", null);
        }
        return toDoubleList(response.getResults().get(0).getOutput());
    }

    private String sanitize(String text) {
        // Remove nulls, collapse pathological whitespace, keep content
        String s = text.replace("\u0000", "");
        s = s.replaceAll("[ \\t\\x0B\\f\\r]+", " ");
        s = s.replaceAll("\\n{3,}", "\n\n");
        return s.trim();
    }

    private List<Double> toDoubleList(float[] array) {
        List<Double> list = new ArrayList<>(array.length);
        for (float f : array) list.add((double) f);
        return list;
    }
}
