package com.opsrunner.app.cli;

import com.opsrunner.app.config.RunnerProperties;
import com.opsrunner.core.exception.RunnerException;
import com.opsrunner.core.model.UploadInfo;
import com.opsrunner.core.model.Workflow;
import com.opsrunner.core.model.WorkflowExecution;
import com.opsrunner.engine.orchestrator.TaskOrchestrator;
import com.opsrunner.engine.service.WorkflowService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs the operations requested on the command line: first the
 * {@code --workflow} file, then the {@code --upload} file. The first failure
 * stops the run and sets exit code 1.
 */
@Component
public class RunnerCommand implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(RunnerCommand.class);

    static final String WORKFLOW_OPTION = "workflow";
    static final String UPLOAD_OPTION = "upload";

    private final TaskOrchestrator orchestrator;
    private final WorkflowService workflowService;
    private final RunnerProperties properties;
    private volatile int exitCode = 0;

    public RunnerCommand(TaskOrchestrator orchestrator, WorkflowService workflowService, RunnerProperties properties) {
        this.orchestrator = orchestrator;
        this.workflowService = workflowService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("Starting OpsRunner");
        prepareDirectories();

        String workflow = singleOption(args, WORKFLOW_OPTION);
        String upload = singleOption(args, UPLOAD_OPTION);

        if (workflow == null && upload == null) {
            List<Workflow> available = workflowService.listWorkflows();
            log.info("Nothing to run; {} workflows in {}", available.size(),
                properties.getWorkflow().getWorkflowDir());
            available.forEach(w -> log.info("  {} v{} ({} steps)", w.name(), w.version(), w.steps().size()));
            return;
        }

        try {
            if (workflow != null) {
                log.info("Executing workflow: {}", workflow);
                WorkflowExecution execution = orchestrator.submitWorkflow(Path.of(workflow)).await();
                log.info("Workflow execution {} {} ({} steps)",
                    execution.id(), execution.status(), execution.stepsExecuted().size());
            }
            if (upload != null) {
                log.info("Processing upload: {}", upload);
                UploadInfo info = orchestrator.submitUpload(Path.of(upload)).await();
                log.info("Upload {} stored at {}", info.id(), info.processedPath());
            }
            log.info("OpsRunner completed successfully");
        } catch (RunnerException e) {
            exitCode = 1;
            log.error("Run failed [{}]: {}", e.getErrorCode(), e.getMessage());
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void prepareDirectories() {
        RunnerProperties.SystemProperties system = properties.getSystem();
        for (Path dir : List.of(system.getTempDir(), system.getCacheDir())) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot create working directory " + dir, e);
            }
        }
    }

    private static String singleOption(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        if (values.size() > 1) {
            log.warn("--{} given {} times; using the last value", name, values.size());
        }
        return values.get(values.size() - 1);
    }
}
