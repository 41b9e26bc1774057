package org.studyhub.studyindex.exception;

/**
 * Raised when a similarity query fails after exhausting its retry budget, or fails logically.
 */
public class SearchException extends VectorStoreException {

    public SearchException(String message, Throwable cause) {
        super(ErrorCode.SEARCH_FAILED, message, false, cause);
    }
}
