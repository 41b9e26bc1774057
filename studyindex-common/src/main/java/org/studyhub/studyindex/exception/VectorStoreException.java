package org.studyhub.studyindex.exception;

import lombok.Getter;

/**
 * Base type for every failure reported by the vector store client.
 *
 * <p>Transport exceptions from the HTTP layer are always wrapped into one of the subclasses,
 * so callers only ever need to inspect {@link #getCode()}.</p>
 */
@Getter
public abstract class VectorStoreException extends RuntimeException {

    private final ErrorCode code;
    private final boolean retryable;

    protected VectorStoreException(ErrorCode code, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.retryable = retryable;
    }
}
