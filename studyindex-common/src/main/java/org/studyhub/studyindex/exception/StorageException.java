package org.studyhub.studyindex.exception;

public class StorageException extends VectorStoreException {

    public StorageException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_FAILED, message, false, cause);
    }

    public StorageException(ErrorCode code, String message) {
        super(code, message, false, null);
    }
}
