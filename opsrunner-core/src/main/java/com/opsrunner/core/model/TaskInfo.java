package com.opsrunner.core.model;

import com.opsrunner.core.exception.InvalidStateTransitionException;
import java.time.Instant;
import java.util.UUID;

/**
 * Orchestrator-level record of one submitted unit of work.
 * Immutable; every lifecycle step produces a new copy.
 *
 * Invariants:
 * - status only moves forward, see {@link TaskStatus#canTransitionTo}
 * - startedAt set once the task leaves PENDING for RUNNING
 * - completedAt set iff status is terminal
 */
public record TaskInfo(
    UUID id,
    TaskType taskType,
    TaskStatus status,
    String subject,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    String errorMessage
) {
    /**
     * Create a new task in PENDING status.
     */
    public static TaskInfo create(TaskType taskType, String subject, Instant now) {
        return new TaskInfo(UUID.randomUUID(), taskType, TaskStatus.PENDING, subject, now, null, null, null);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Create a copy in RUNNING status.
     */
    public TaskInfo withRunning(Instant now) {
        return transition(TaskStatus.RUNNING, now, null, errorMessage);
    }

    /**
     * Create a copy in COMPLETED status.
     */
    public TaskInfo withCompleted(Instant now) {
        return transition(TaskStatus.COMPLETED, startedAt, now, null);
    }

    /**
     * Create a copy in FAILED status with the given error.
     */
    public TaskInfo withFailed(String error, Instant now) {
        return transition(TaskStatus.FAILED, startedAt, now, error);
    }

    /**
     * Create a copy in CANCELLED status.
     */
    public TaskInfo withCancelled(Instant now) {
        return transition(TaskStatus.CANCELLED, startedAt, now, errorMessage);
    }

    private TaskInfo transition(TaskStatus target, Instant started, Instant completed, String error) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateTransitionException("Task", status.name(), target.name());
        }
        return new TaskInfo(id, taskType, target, subject, createdAt, started, completed, error);
    }
}
