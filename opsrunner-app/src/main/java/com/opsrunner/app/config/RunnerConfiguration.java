package com.opsrunner.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsrunner.core.json.RunnerJson;
import com.opsrunner.core.repository.ExecutionRecordRepository;
import com.opsrunner.core.repository.TaskRegistry;
import com.opsrunner.core.repository.UploadRecordRepository;
import com.opsrunner.core.repository.WorkflowDefinitionRepository;
import com.opsrunner.engine.config.UploadSettings;
import com.opsrunner.engine.config.WorkflowSettings;
import com.opsrunner.engine.executor.CommandRunner;
import com.opsrunner.engine.executor.ConditionEvaluator;
import com.opsrunner.engine.executor.ProcessCommandRunner;
import com.opsrunner.engine.executor.StepExecutor;
import com.opsrunner.engine.lifecycle.TaskCleanupScheduler;
import com.opsrunner.engine.metrics.WorkflowMetrics;
import com.opsrunner.engine.orchestrator.TaskOrchestrator;
import com.opsrunner.engine.persistence.FileExecutionRecordRepository;
import com.opsrunner.engine.persistence.FileUploadRecordRepository;
import com.opsrunner.engine.persistence.FileWorkflowDefinitionRepository;
import com.opsrunner.engine.persistence.InMemoryTaskRegistry;
import com.opsrunner.engine.scheduler.StepScheduler;
import com.opsrunner.engine.service.UploadService;
import com.opsrunner.engine.service.WorkflowService;
import com.opsrunner.engine.upload.FileUploadPipeline;
import com.opsrunner.engine.workflow.WorkflowEngine;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the engine components from {@link RunnerProperties}.
 */
@Configuration
@EnableConfigurationProperties(RunnerProperties.class)
public class RunnerConfiguration {

    // ========== Settings and shared infrastructure ==========

    @Bean
    public WorkflowSettings workflowSettings(RunnerProperties properties) {
        return properties.getWorkflow().toSettings();
    }

    @Bean
    public UploadSettings uploadSettings(RunnerProperties properties) {
        return properties.getUpload().toSettings();
    }

    @Bean
    public ObjectMapper runnerObjectMapper() {
        return RunnerJson.newMapper();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MeterRegistry meterRegistry() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        registry.config().commonTags("application", "opsrunner");
        return registry;
    }

    @Bean
    public WorkflowMetrics workflowMetrics(MeterRegistry meterRegistry) {
        return new WorkflowMetrics(meterRegistry);
    }

    // ========== Repositories ==========

    @Bean
    public WorkflowDefinitionRepository workflowDefinitionRepository(WorkflowSettings settings, ObjectMapper mapper) {
        return new FileWorkflowDefinitionRepository(settings.workflowDir(), mapper);
    }

    @Bean
    public ExecutionRecordRepository executionRecordRepository(WorkflowSettings settings, ObjectMapper mapper) {
        return new FileExecutionRecordRepository(settings.executionsDir(), mapper);
    }

    @Bean
    public UploadRecordRepository uploadRecordRepository(UploadSettings settings, ObjectMapper mapper) {
        return new FileUploadRecordRepository(settings.recordsDir(), mapper);
    }

    @Bean
    public TaskRegistry taskRegistry() {
        return new InMemoryTaskRegistry();
    }

    // ========== Workflow execution ==========

    @Bean(destroyMethod = "close")
    public ProcessCommandRunner commandRunner() {
        return new ProcessCommandRunner();
    }

    @Bean
    public StepExecutor stepExecutor(CommandRunner commandRunner, WorkflowSettings settings, WorkflowMetrics metrics) {
        return new StepExecutor(commandRunner, new ConditionEvaluator(), settings, metrics);
    }

    @Bean
    public WorkflowService workflowService(
            WorkflowDefinitionRepository definitionRepository,
            ExecutionRecordRepository recordRepository,
            StepExecutor stepExecutor,
            WorkflowMetrics metrics) {
        return new WorkflowEngine(definitionRepository, recordRepository, new StepScheduler(), stepExecutor, metrics);
    }

    @Bean
    public UploadService uploadService(UploadSettings settings, UploadRecordRepository recordRepository, Clock clock) {
        return new FileUploadPipeline(settings, recordRepository, clock);
    }

    // ========== Orchestration ==========

    @Bean(destroyMethod = "close")
    public TaskOrchestrator taskOrchestrator(
            WorkflowService workflowService,
            UploadService uploadService,
            TaskRegistry taskRegistry,
            WorkflowSettings workflowSettings,
            UploadSettings uploadSettings,
            WorkflowMetrics metrics,
            Clock clock) {
        return new TaskOrchestrator(workflowService, uploadService, taskRegistry,
            workflowSettings, uploadSettings, metrics, clock);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public TaskCleanupScheduler taskCleanupScheduler(TaskOrchestrator orchestrator, RunnerProperties properties) {
        return new TaskCleanupScheduler(orchestrator, properties.getSystem().getCleanupInterval());
    }
}
