package com.opsrunner.app.cli;

import com.opsrunner.app.config.RunnerProperties;
import com.opsrunner.core.exception.WorkflowDefinitionException;
import com.opsrunner.core.model.ExecutionStatus;
import com.opsrunner.core.model.ProcessingStatus;
import com.opsrunner.core.model.UploadInfo;
import com.opsrunner.core.model.UploadMetadata;
import com.opsrunner.core.model.Workflow;
import com.opsrunner.core.model.WorkflowExecution;
import com.opsrunner.engine.orchestrator.TaskHandle;
import com.opsrunner.engine.orchestrator.TaskOrchestrator;
import com.opsrunner.engine.service.WorkflowService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RunnerCommandTest {

    @TempDir
    Path workDir;

    private TaskOrchestrator orchestrator;
    private WorkflowService workflowService;
    private RunnerCommand command;

    @BeforeEach
    void setUp() {
        orchestrator = mock(TaskOrchestrator.class);
        workflowService = mock(WorkflowService.class);
        RunnerProperties properties = new RunnerProperties();
        properties.getSystem().setTempDir(workDir.resolve("temp"));
        properties.getSystem().setCacheDir(workDir.resolve("cache"));
        command = new RunnerCommand(orchestrator, workflowService, properties);
    }

    private static WorkflowExecution completedExecution() {
        return WorkflowExecution.create(Workflow.builder().name("deploy").build())
            .withStatus(ExecutionStatus.RUNNING)
            .withStatus(ExecutionStatus.COMPLETED);
    }

    private static UploadInfo storedUpload(Path path) {
        return new UploadInfo(UUID.randomUUID(), path.getFileName().toString(), path, path, 1,
            "text/plain", Instant.now(), ProcessingStatus.COMPLETED, UploadMetadata.of("00"));
    }

    private static <T> TaskHandle<T> done(T value) {
        return new TaskHandle<>(UUID.randomUUID(), CompletableFuture.completedFuture(value));
    }

    private static <T> TaskHandle<T> failed(RuntimeException error) {
        return new TaskHandle<>(UUID.randomUUID(), CompletableFuture.failedFuture(error));
    }

    @Test
    void runsWorkflowThenUpload() {
        when(orchestrator.submitWorkflow(Path.of("deploy.json"))).thenReturn(done(completedExecution()));
        when(orchestrator.submitUpload(Path.of("report.txt"))).thenReturn(done(storedUpload(Path.of("report.txt"))));

        command.run(new DefaultApplicationArguments("--workflow=deploy.json", "--upload=report.txt"));

        var order = inOrder(orchestrator);
        order.verify(orchestrator).submitWorkflow(Path.of("deploy.json"));
        order.verify(orchestrator).submitUpload(Path.of("report.txt"));
        assertThat(command.getExitCode()).isZero();
        assertThat(workDir.resolve("temp")).isDirectory();
        assertThat(workDir.resolve("cache")).isDirectory();
    }

    @Test
    void failedWorkflowSetsExitCodeAndSkipsUpload() {
        when(orchestrator.submitWorkflow(any())).thenReturn(failed(new WorkflowDefinitionException("bad file")));

        command.run(new DefaultApplicationArguments("--workflow=broken.json", "--upload=report.txt"));

        assertThat(command.getExitCode()).isEqualTo(1);
        verify(orchestrator, never()).submitUpload(any());
    }

    @Test
    void withoutOperationsListsAvailableWorkflows() {
        when(workflowService.listWorkflows()).thenReturn(List.of(Workflow.builder().name("nightly").build()));

        command.run(new DefaultApplicationArguments());

        verify(workflowService).listWorkflows();
        verifyNoInteractions(orchestrator);
        assertThat(command.getExitCode()).isZero();
    }
}
