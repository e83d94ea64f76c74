package com.opsrunner.core.exception;

/**
 * Base exception for all runner errors.
 */
public class RunnerException extends RuntimeException {

    private final String errorCode;

    public RunnerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public RunnerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
