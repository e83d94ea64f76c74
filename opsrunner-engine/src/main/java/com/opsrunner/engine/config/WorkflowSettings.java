package com.opsrunner.engine.config;

import com.opsrunner.core.model.RetryPolicy;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Workflow subsystem settings.
 *
 * @param workflowDir Directory holding definitions; execution records go to {@code executions/} below it
 * @param maxConcurrentWorkflows Size of the shared concurrency limiter
 * @param defaultTimeout Per-step timeout when the step does not set one
 * @param defaultRetryPolicy Retry budget and backoff when the step does not set a retry count
 */
public record WorkflowSettings(
    Path workflowDir,
    int maxConcurrentWorkflows,
    Duration defaultTimeout,
    RetryPolicy defaultRetryPolicy
) {
    public WorkflowSettings {
        if (workflowDir == null) {
            throw new IllegalArgumentException("workflowDir must be set");
        }
        if (maxConcurrentWorkflows < 1) {
            throw new IllegalArgumentException("maxConcurrentWorkflows must be >= 1, got " + maxConcurrentWorkflows);
        }
        if (defaultTimeout == null || defaultTimeout.isZero() || defaultTimeout.isNegative()) {
            throw new IllegalArgumentException("defaultTimeout must be > 0");
        }
        if (defaultRetryPolicy == null) {
            throw new IllegalArgumentException("defaultRetryPolicy must be set");
        }
    }

    public static WorkflowSettings defaults(Path workflowDir) {
        return new WorkflowSettings(workflowDir, 4, Duration.ofHours(1), RetryPolicy.defaultPolicy());
    }

    public Path executionsDir() {
        return workflowDir.resolve("executions");
    }
}
