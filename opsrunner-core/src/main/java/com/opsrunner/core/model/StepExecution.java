package com.opsrunner.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Outcome of running one step within a workflow execution.
 *
 * Invariants:
 * - output set only if status == COMPLETED
 * - retryCount never exceeds the step's effective max retries
 * - completedAt set iff status is terminal
 */
public record StepExecution(
    @JsonProperty("step_id") String stepId,
    ExecutionStatus status,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("completed_at") Instant completedAt,
    String output,
    @JsonProperty("error_message") String errorMessage,
    @JsonProperty("retry_count") int retryCount
) {
    /**
     * A step whose condition evaluated false. The command never ran.
     */
    public static StepExecution skipped(String stepId, Instant startedAt) {
        return new StepExecution(stepId, ExecutionStatus.SKIPPED, startedAt, Instant.now(), null, null, 0);
    }

    /**
     * A step whose command succeeded on attempt {@code retryCount}.
     */
    public static StepExecution completed(String stepId, Instant startedAt, String output, int retryCount) {
        return new StepExecution(stepId, ExecutionStatus.COMPLETED, startedAt, Instant.now(), output, null, retryCount);
    }

    /**
     * A step that exhausted its attempts; carries the last observed error.
     */
    public static StepExecution failed(String stepId, Instant startedAt, String errorMessage, int retryCount) {
        return new StepExecution(stepId, ExecutionStatus.FAILED, startedAt, Instant.now(), null, errorMessage, retryCount);
    }

    @JsonIgnore
    public boolean isFailed() {
        return status == ExecutionStatus.FAILED;
    }
}
