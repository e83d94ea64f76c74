package com.opsrunner.core.exception;

/**
 * Thrown when a file, record or task is not found.
 */
public class NotFoundException extends RunnerException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
