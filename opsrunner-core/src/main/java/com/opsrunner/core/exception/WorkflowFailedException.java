package com.opsrunner.core.exception;

import com.opsrunner.core.model.WorkflowExecution;

/**
 * Thrown when a step fails terminally and aborts its workflow execution.
 * Carries the partial execution record, which has already been persisted.
 */
public class WorkflowFailedException extends RunnerException {

    public static final String ERROR_CODE = "WORKFLOW_FAILED";

    private final transient WorkflowExecution execution;
    private final String failedStepId;

    public WorkflowFailedException(WorkflowExecution execution, String failedStepId, String stepError) {
        super(ERROR_CODE, String.format(
            "Step %s failed: %s", failedStepId, stepError
        ));
        this.execution = execution;
        this.failedStepId = failedStepId;
    }

    public WorkflowExecution getExecution() {
        return execution;
    }

    public String getFailedStepId() {
        return failedStepId;
    }
}
