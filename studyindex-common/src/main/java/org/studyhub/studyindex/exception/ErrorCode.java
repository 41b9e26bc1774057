package org.studyhub.studyindex.exception;

/**
 * Stable, machine-readable error codes surfaced by the retrieval engine.
 *
 * <p>The string value is part of the public contract and must not change between releases.</p>
 */
public enum ErrorCode {

    CONNECTION_FAILED("CONNECTION_FAILED"),
    COLLECTION_UNAVAILABLE("COLLECTION_UNAVAILABLE"),
    SEARCH_FAILED("SEARCH_FAILED"),
    STORAGE_FAILED("STORAGE_FAILED"),
    INVALID_DOCUMENTS("INVALID_DOCUMENTS"),
    DELETE_FAILED("DELETE_FAILED"),
    INVALID_DELETE("INVALID_DELETE"),
    EMBEDDING_UNAVAILABLE("EMBEDDING_UNAVAILABLE");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Whether the error describes a caller mistake rather than a backend problem.
     */
    public boolean isInvalidInput() {
        return this == INVALID_DOCUMENTS || this == INVALID_DELETE;
    }
}
