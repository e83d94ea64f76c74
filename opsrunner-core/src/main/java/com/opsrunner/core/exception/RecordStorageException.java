package com.opsrunner.core.exception;

/**
 * Thrown when a JSON record cannot be written to or read from disk.
 */
public class RecordStorageException extends RunnerException {

    public static final String ERROR_CODE = "RECORD_STORAGE_FAILED";

    public RecordStorageException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
