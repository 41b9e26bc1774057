package org.studyhub.studyindex.indexer.controller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.studyhub.studyindex.exception.EmbeddingException;
import org.studyhub.studyindex.exception.ErrorCode;
import org.studyhub.studyindex.exception.VectorStoreException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Translates engine failures into {@code {error, code, message, timestamp}} bodies.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(VectorStoreException.class)
    public ResponseEntity<Map<String, Object>> handleVectorStore(VectorStoreException e) {
        HttpStatus status = statusFor(e.getCode());
        if (status.is5xxServerError()) {
            log.error("Vector store request failed [{}]: {}", e.getCode().code(), e.getMessage());
        } else {
            log.debug("Rejected vector store request [{}]: {}", e.getCode().code(), e.getMessage());
        }
        return body(status, e.getCode().code(), e.getMessage());
    }

    @ExceptionHandler(EmbeddingException.class)
    public ResponseEntity<Map<String, Object>> handleEmbedding(EmbeddingException e) {
        log.error("Embedding failed: {}", e.getMessage());
        return body(HttpStatus.INTERNAL_SERVER_ERROR, e.getCode().code(), e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException e) {
        return body(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", e.getMessage());
    }

    static HttpStatus statusFor(ErrorCode code) {
        if (code.isInvalidInput()) {
            return HttpStatus.BAD_REQUEST;
        }
        switch (code) {
            case CONNECTION_FAILED:
            case COLLECTION_UNAVAILABLE:
                return HttpStatus.SERVICE_UNAVAILABLE;
            case SEARCH_FAILED:
            case STORAGE_FAILED:
            case DELETE_FAILED:
                return HttpStatus.BAD_GATEWAY;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", status.getReasonPhrase());
        body.put("code", code);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(body);
    }
}
