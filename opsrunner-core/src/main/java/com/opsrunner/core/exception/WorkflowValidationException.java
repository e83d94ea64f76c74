package com.opsrunner.core.exception;

/**
 * Thrown when a workflow's step graph is invalid.
 * Raised before any step runs; no execution record is written.
 */
public class WorkflowValidationException extends RunnerException {

    public static final String ERROR_CODE = "WORKFLOW_VALIDATION_FAILED";

    private final String stepId;

    public WorkflowValidationException(String stepId, String message) {
        this(ERROR_CODE, stepId, message);
    }

    protected WorkflowValidationException(String errorCode, String stepId, String message) {
        super(errorCode, message);
        this.stepId = stepId;
    }

    /**
     * The step at which the problem was detected.
     */
    public String getStepId() {
        return stepId;
    }
}
