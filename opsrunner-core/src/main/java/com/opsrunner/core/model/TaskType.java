package com.opsrunner.core.model;

/**
 * Kinds of work the orchestrator can supervise.
 */
public enum TaskType {
    /**
     * Upload task - runs the upload pipeline over a file.
     */
    UPLOAD,

    /**
     * Workflow task - runs a workflow definition through the engine.
     */
    WORKFLOW,

    /**
     * System task - internal housekeeping.
     */
    SYSTEM
}
