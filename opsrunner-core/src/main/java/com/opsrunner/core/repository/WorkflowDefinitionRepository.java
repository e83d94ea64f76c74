package com.opsrunner.core.repository;

import com.opsrunner.core.model.Workflow;
import java.nio.file.Path;
import java.util.List;

/**
 * Source of workflow definitions.
 */
public interface WorkflowDefinitionRepository {

    /**
     * Load and parse a single definition file.
     *
     * @param definitionPath Path to the definition file
     * @return The parsed workflow
     * @throws com.opsrunner.core.exception.WorkflowDefinitionException if the file
     *         does not exist, cannot be read or is malformed
     */
    Workflow load(Path definitionPath);

    /**
     * All parseable definitions in the definition directory.
     */
    List<Workflow> findAll();
}
