package com.opsrunner.core.exception;

/**
 * Thrown when a step depends on a step id that is not part of the workflow.
 */
public class DependencyNotFoundException extends WorkflowValidationException {

    public static final String ERROR_CODE = "DEPENDENCY_NOT_FOUND";

    private final String dependencyId;

    public DependencyNotFoundException(String stepId, String dependencyId) {
        super(ERROR_CODE, stepId, String.format(
            "Dependency step not found: %s (required by step %s)",
            dependencyId, stepId
        ));
        this.dependencyId = dependencyId;
    }

    public String getDependencyId() {
        return dependencyId;
    }
}
