package com.opsrunner.core.exception;

/**
 * Thrown when the step dependency graph contains a cycle.
 * The step id is the one at which the cycle was re-entered.
 */
public class CyclicDependencyException extends WorkflowValidationException {

    public static final String ERROR_CODE = "CIRCULAR_DEPENDENCY";

    public CyclicDependencyException(String stepId) {
        super(ERROR_CODE, stepId, "Circular dependency detected for step: " + stepId);
    }
}
