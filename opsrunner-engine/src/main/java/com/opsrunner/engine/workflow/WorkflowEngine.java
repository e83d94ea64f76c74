package com.opsrunner.engine.workflow;

import com.opsrunner.core.exception.WorkflowFailedException;
import com.opsrunner.core.model.ExecutionStatus;
import com.opsrunner.core.model.StepExecution;
import com.opsrunner.core.model.Workflow;
import com.opsrunner.core.model.WorkflowExecution;
import com.opsrunner.core.model.WorkflowStep;
import com.opsrunner.core.repository.ExecutionRecordRepository;
import com.opsrunner.core.repository.WorkflowDefinitionRepository;
import com.opsrunner.engine.executor.StepExecutor;
import com.opsrunner.engine.logging.LoggingContext;
import com.opsrunner.engine.metrics.WorkflowMetrics;
import com.opsrunner.engine.scheduler.StepScheduler;
import com.opsrunner.engine.service.WorkflowService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs one workflow definition end to end.
 *
 * Steps run strictly one after another in dependency order. The first
 * failed step aborts the run; its error becomes the run's error and the
 * partial history is kept. A record is persisted for every run that got
 * past graph validation, completed or failed.
 */
public class WorkflowEngine implements WorkflowService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

    private final WorkflowDefinitionRepository definitionRepository;
    private final ExecutionRecordRepository recordRepository;
    private final StepScheduler stepScheduler;
    private final StepExecutor stepExecutor;
    private final WorkflowMetrics metrics;

    public WorkflowEngine(
            WorkflowDefinitionRepository definitionRepository,
            ExecutionRecordRepository recordRepository,
            StepScheduler stepScheduler,
            StepExecutor stepExecutor,
            WorkflowMetrics metrics) {
        this.definitionRepository = definitionRepository;
        this.recordRepository = recordRepository;
        this.stepScheduler = stepScheduler;
        this.stepExecutor = stepExecutor;
        this.metrics = metrics;
    }

    @Override
    public WorkflowExecution executeWorkflow(Path definitionPath) {
        Workflow workflow = definitionRepository.load(definitionPath);
        WorkflowExecution execution = WorkflowExecution.create(workflow);

        try (var ctx = LoggingContext.forExecution(execution.id(), workflow.name())) {
            List<WorkflowStep> order = stepScheduler.order(workflow.steps());

            execution = execution.withStatus(ExecutionStatus.RUNNING);
            metrics.workflowStarted(workflow.name());
            log.info("Starting workflow {} v{} ({} steps)", workflow.name(), workflow.version(), order.size());

            for (WorkflowStep step : order) {
                StepExecution outcome = stepExecutor.run(step, execution);
                execution = execution.withStepExecuted(outcome);

                if (outcome.isFailed()) {
                    execution = execution.withFailure(outcome.errorMessage());
                    recordRepository.save(execution);
                    metrics.workflowFailed(workflow.name());
                    log.error("Workflow {} failed at step {}: {}",
                        workflow.name(), step.id(), outcome.errorMessage());
                    throw new WorkflowFailedException(execution, step.id(), outcome.errorMessage());
                }
            }

            execution = execution.withStatus(ExecutionStatus.COMPLETED);
            recordRepository.save(execution);
            metrics.workflowCompleted(workflow.name());
            log.info("Workflow {} completed ({} steps executed)", workflow.name(), execution.stepsExecuted().size());
            return execution;
        }
    }

    @Override
    public List<Workflow> listWorkflows() {
        return definitionRepository.findAll();
    }

    @Override
    public Optional<WorkflowExecution> getExecution(UUID executionId) {
        return recordRepository.findById(executionId);
    }
}
