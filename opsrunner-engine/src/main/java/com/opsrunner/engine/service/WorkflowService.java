package com.opsrunner.engine.service;

import com.opsrunner.core.model.Workflow;
import com.opsrunner.core.model.WorkflowExecution;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for running workflow definitions.
 */
public interface WorkflowService {

    /**
     * Load a definition and run it to completion.
     *
     * @param definitionPath Path to the workflow JSON file
     * @return The COMPLETED execution, already persisted
     * @throws com.opsrunner.core.exception.WorkflowDefinitionException if the file cannot be loaded
     * @throws com.opsrunner.core.exception.WorkflowValidationException if the step graph is invalid
     * @throws com.opsrunner.core.exception.WorkflowFailedException if a step fails; carries the
     *         persisted FAILED execution
     */
    WorkflowExecution executeWorkflow(Path definitionPath);

    /**
     * All parseable definitions in the workflow directory.
     */
    List<Workflow> listWorkflows();

    /**
     * Find a persisted execution record.
     */
    Optional<WorkflowExecution> getExecution(UUID executionId);
}
