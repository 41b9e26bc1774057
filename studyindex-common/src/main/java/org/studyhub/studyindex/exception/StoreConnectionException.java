package org.studyhub.studyindex.exception;

/**
 * Raised when the store heartbeat cannot be confirmed within the connection retry budget.
 */
public class StoreConnectionException extends VectorStoreException {

    public StoreConnectionException(String message, Throwable cause) {
        super(ErrorCode.CONNECTION_FAILED, message, true, cause);
    }
}
