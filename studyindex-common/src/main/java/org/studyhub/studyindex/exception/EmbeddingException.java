package org.studyhub.studyindex.exception;

/**
 * Raised when the embedding model cannot produce a vector.
 *
 * <p>Never retried: an unusable model is a deployment problem, not transient load.</p>
 */
public class EmbeddingException extends RuntimeException {

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }

    public ErrorCode getCode() {
        return ErrorCode.EMBEDDING_UNAVAILABLE;
    }
}
