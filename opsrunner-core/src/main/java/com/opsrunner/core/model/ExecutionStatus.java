package com.opsrunner.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lifecycle states shared by workflow executions and step executions.
 * Transitions follow a strict state machine - see {@link #canTransitionTo}.
 */
public enum ExecutionStatus {
    /**
     * Created, not yet started.
     * Transitions: -> RUNNING, SKIPPED, FAILED, CANCELLED
     */
    @JsonProperty("Pending")
    PENDING,

    /**
     * Active execution in progress.
     * Transitions: -> COMPLETED, FAILED, CANCELLED
     */
    @JsonProperty("Running")
    RUNNING,

    /**
     * Successfully finished. Terminal state.
     */
    @JsonProperty("Completed")
    COMPLETED,

    /**
     * Exhausted retries or aborted by a failing step. Terminal state.
     */
    @JsonProperty("Failed")
    FAILED,

    /**
     * Cancelled by an operator. Terminal state.
     */
    @JsonProperty("Cancelled")
    CANCELLED,

    /**
     * Condition evaluated false, command never ran. Terminal state.
     * Reached directly from PENDING.
     */
    @JsonProperty("Skipped")
    SKIPPED;

    /**
     * Check if this status is terminal (no further transitions possible).
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED || this == SKIPPED;
    }

    /**
     * Check if this status can transition to the target status.
     */
    public boolean canTransitionTo(ExecutionStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING || target == SKIPPED || target == FAILED || target == CANCELLED;
            case RUNNING -> target == COMPLETED || target == FAILED || target == CANCELLED;
            case COMPLETED, FAILED, CANCELLED, SKIPPED -> false;
        };
    }
}
