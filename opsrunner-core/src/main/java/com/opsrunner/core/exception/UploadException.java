package com.opsrunner.core.exception;

/**
 * Thrown when an upload fails validation or one of its processing steps.
 */
public class UploadException extends RunnerException {

    public static final String VALIDATION_FAILED = "UPLOAD_VALIDATION_FAILED";
    public static final String PROCESSING_FAILED = "UPLOAD_PROCESSING_FAILED";

    public UploadException(String errorCode, String message) {
        super(errorCode, message);
    }

    public UploadException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static UploadException validation(String message) {
        return new UploadException(VALIDATION_FAILED, message);
    }
}
