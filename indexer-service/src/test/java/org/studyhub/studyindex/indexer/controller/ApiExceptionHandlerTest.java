package org.studyhub.studyindex.indexer.controller;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.studyhub.studyindex.exception.DeleteException;
import org.studyhub.studyindex.exception.EmbeddingException;
import org.studyhub.studyindex.exception.ErrorCode;
import org.studyhub.studyindex.exception.StoreConnectionException;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class ApiExceptionHandlerTest {

    private final ApiExceptionHandler handler = new ApiExceptionHandler();

    @Test
    void errorCodesMapToHttpStatus() {
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, ApiExceptionHandler.statusFor(ErrorCode.CONNECTION_FAILED));
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, ApiExceptionHandler.statusFor(ErrorCode.COLLECTION_UNAVAILABLE));
        assertEquals(HttpStatus.BAD_GATEWAY, ApiExceptionHandler.statusFor(ErrorCode.SEARCH_FAILED));
        assertEquals(HttpStatus.BAD_GATEWAY, ApiExceptionHandler.statusFor(ErrorCode.STORAGE_FAILED));
        assertEquals(HttpStatus.BAD_GATEWAY, ApiExceptionHandler.statusFor(ErrorCode.DELETE_FAILED));
        assertEquals(HttpStatus.BAD_REQUEST, ApiExceptionHandler.statusFor(ErrorCode.INVALID_DOCUMENTS));
        assertEquals(HttpStatus.BAD_REQUEST, ApiExceptionHandler.statusFor(ErrorCode.INVALID_DELETE));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, ApiExceptionHandler.statusFor(ErrorCode.EMBEDDING_UNAVAILABLE));
    }

    @Test
    void bodyCarriesCodeMessageAndTimestamp() {
        ResponseEntity<Map<String, Object>> response = handler.handleVectorStore(
                new DeleteException(ErrorCode.INVALID_DELETE, "Refusing to delete without ids or filter"));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        Map<String, Object> body = response.getBody();
        assertNotNull(body);
        assertEquals("Bad Request", body.get("error"));
        assertEquals("INVALID_DELETE", body.get("code"));
        assertEquals("Refusing to delete without ids or filter", body.get("message"));
        assertNotNull(body.get("timestamp"));
    }

    @Test
    void connectionAndEmbeddingFailures() {
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE,
                handler.handleVectorStore(new StoreConnectionException("unreachable", null)).getStatusCode());

        ResponseEntity<Map<String, Object>> embedding =
                handler.handleEmbedding(new EmbeddingException("model offline", null));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, embedding.getStatusCode());
        assertEquals("EMBEDDING_UNAVAILABLE", embedding.getBody().get("code"));
    }
}
