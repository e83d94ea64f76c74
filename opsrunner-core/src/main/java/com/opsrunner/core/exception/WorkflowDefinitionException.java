package com.opsrunner.core.exception;

/**
 * Thrown when a workflow definition file is missing, unreadable or malformed.
 * Fatal to the run before it starts; no execution record is written.
 */
public class WorkflowDefinitionException extends RunnerException {

    public static final String ERROR_CODE = "WORKFLOW_DEFINITION_INVALID";

    public WorkflowDefinitionException(String message) {
        super(ERROR_CODE, message);
    }

    public WorkflowDefinitionException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
