package com.opsrunner.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.opsrunner.core.exception.InvalidStateTransitionException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A single run of a Workflow.
 * Owned by the workflow engine while running, persisted once as an
 * immutable record when the run ends.
 *
 * Invariants:
 * - stepsExecuted is in the order the steps actually ran
 * - status transitions follow {@link ExecutionStatus#canTransitionTo}
 * - variables are a copy of the workflow's variables and never change during the run
 */
public record WorkflowExecution(
    // Primary key
    UUID id,

    // Foreign key to definition
    @JsonProperty("workflow_id") UUID workflowId,

    // State
    ExecutionStatus status,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("completed_at") Instant completedAt,
    @JsonProperty("steps_executed") List<StepExecution> stepsExecuted,

    // Data
    Map<String, String> variables,

    // Error tracking
    @JsonProperty("error_message") String errorMessage
) {
    public WorkflowExecution {
        stepsExecuted = stepsExecuted == null ? List.of() : List.copyOf(stepsExecuted);
        variables = variables == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    /**
     * Create a new execution of the given workflow in PENDING status.
     */
    public static WorkflowExecution create(Workflow workflow) {
        return new WorkflowExecution(
            UUID.randomUUID(),
            workflow.id(),
            ExecutionStatus.PENDING,
            Instant.now(),
            null,
            List.of(),
            workflow.variables(),
            null
        );
    }

    /**
     * Create a copy in the given status.
     *
     * @throws InvalidStateTransitionException if the state machine forbids the move
     */
    public WorkflowExecution withStatus(ExecutionStatus newStatus) {
        if (!status.canTransitionTo(newStatus)) {
            throw new InvalidStateTransitionException("WorkflowExecution", status.name(), newStatus.name());
        }
        return new WorkflowExecution(
            id, workflowId, newStatus, startedAt,
            newStatus.isTerminal() ? Instant.now() : completedAt,
            stepsExecuted, variables, errorMessage
        );
    }

    /**
     * Create a copy with one more step outcome appended.
     */
    public WorkflowExecution withStepExecuted(StepExecution stepExecution) {
        var newSteps = new ArrayList<>(stepsExecuted);
        newSteps.add(stepExecution);
        return new WorkflowExecution(
            id, workflowId, status, startedAt, completedAt,
            newSteps, variables, errorMessage
        );
    }

    /**
     * Create a copy that has failed with the given top-level error.
     */
    public WorkflowExecution withFailure(String error) {
        WorkflowExecution failed = withStatus(ExecutionStatus.FAILED);
        return new WorkflowExecution(
            id, workflowId, failed.status(), startedAt, failed.completedAt(),
            stepsExecuted, variables, error
        );
    }
}
