package org.studyhub.studyindex.exception;

/**
 * Raised when a collection cannot be fetched, created or dropped.
 */
public class CollectionException extends VectorStoreException {

    public CollectionException(String message, Throwable cause) {
        super(ErrorCode.COLLECTION_UNAVAILABLE, message, false, cause);
    }
}
