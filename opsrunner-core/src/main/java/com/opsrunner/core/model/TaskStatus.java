package com.opsrunner.core.model;

/**
 * Lifecycle states for an orchestrator task.
 * Statuses only ever move forward: PENDING -> RUNNING -> {COMPLETED | FAILED | CANCELLED}.
 */
public enum TaskStatus {
    /**
     * Task registered, waiting for a concurrency permit.
     * Transitions: -> RUNNING, FAILED, CANCELLED
     */
    PENDING,

    /**
     * Task body is executing.
     * Transitions: -> COMPLETED, FAILED, CANCELLED
     */
    RUNNING,

    /**
     * Task completed successfully. Terminal state.
     */
    COMPLETED,

    /**
     * Task failed with an error. Terminal state.
     */
    FAILED,

    /**
     * Task was cancelled by an operator. Terminal state.
     */
    CANCELLED;

    /**
     * Check if this status is terminal (no further transitions).
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Check if this status can transition to the target status.
     */
    public boolean canTransitionTo(TaskStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING || target == FAILED || target == CANCELLED;
            case RUNNING -> target == COMPLETED || target == FAILED || target == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
