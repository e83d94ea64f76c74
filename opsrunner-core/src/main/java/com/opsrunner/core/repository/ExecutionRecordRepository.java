package com.opsrunner.core.repository;

import com.opsrunner.core.model.WorkflowExecution;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for finished workflow execution records.
 * Records are written once and never updated.
 */
public interface ExecutionRecordRepository {

    /**
     * Persist a finished execution.
     */
    void save(WorkflowExecution execution);

    /**
     * Find an execution record by ID.
     */
    Optional<WorkflowExecution> findById(UUID executionId);
}
