package org.studyhub.studyindex.exception;

public class DeleteException extends VectorStoreException {

    public DeleteException(String message, Throwable cause) {
        super(ErrorCode.DELETE_FAILED, message, false, cause);
    }

    public DeleteException(ErrorCode code, String message) {
        super(code, message, false, null);
    }
}
