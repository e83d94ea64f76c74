package com.opsrunner.engine.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures runner logs carry the ids needed to follow one task or run.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forStep(stepId)) {
 *     log.info("Running command"); // Automatically includes stepId
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String TASK_ID = "taskId";
    public static final String TASK_TYPE = "taskType";
    public static final String EXECUTION_ID = "executionId";
    public static final String WORKFLOW_NAME = "workflowName";
    public static final String STEP_ID = "stepId";
    public static final String ATTEMPT = "attempt";

    private final String[] keys;

    private LoggingContext(String... keys) {
        this.keys = keys;
    }

    /**
     * Create a logging context for an orchestrator task.
     */
    public static LoggingContext forTask(UUID taskId, String taskType) {
        putIfPresent(TASK_ID, taskId);
        putIfPresent(TASK_TYPE, taskType);
        return new LoggingContext(TASK_ID, TASK_TYPE);
    }

    /**
     * Create a logging context for a workflow execution.
     */
    public static LoggingContext forExecution(UUID executionId, String workflowName) {
        putIfPresent(EXECUTION_ID, executionId);
        putIfPresent(WORKFLOW_NAME, workflowName);
        return new LoggingContext(EXECUTION_ID, WORKFLOW_NAME);
    }

    /**
     * Create a logging context for one step of an execution.
     */
    public static LoggingContext forStep(String stepId) {
        putIfPresent(STEP_ID, stepId);
        return new LoggingContext(STEP_ID, ATTEMPT);
    }

    /**
     * Update the attempt number of the current step context.
     */
    public static void setAttempt(int attempt) {
        MDC.put(ATTEMPT, String.valueOf(attempt));
    }

    private static void putIfPresent(String key, Object value) {
        if (value != null) {
            MDC.put(key, value.toString());
        }
    }

    // Removes only the keys this context added; enclosing contexts keep theirs
    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
    }
}
