package com.opsrunner.engine.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsrunner.core.model.WorkflowExecution;
import com.opsrunner.core.repository.ExecutionRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Optional;
import java.util.UUID;

/**
 * Stores execution records as {@code <executions_dir>/<execution_id>.json}.
 */
public class FileExecutionRecordRepository implements ExecutionRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(FileExecutionRecordRepository.class);

    private final JsonRecordStore<WorkflowExecution> store;

    public FileExecutionRecordRepository(Path executionsDir, ObjectMapper mapper) {
        this.store = new JsonRecordStore<>(executionsDir, mapper, WorkflowExecution.class);
    }

    @Override
    public void save(WorkflowExecution execution) {
        store.write(execution.id().toString(), execution);
        log.debug("Saved execution record {}", store.pathFor(execution.id().toString()));
    }

    @Override
    public Optional<WorkflowExecution> findById(UUID executionId) {
        return store.read(executionId.toString());
    }
}
