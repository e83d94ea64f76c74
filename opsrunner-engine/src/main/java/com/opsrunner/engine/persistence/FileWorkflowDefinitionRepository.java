package com.opsrunner.engine.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsrunner.core.exception.WorkflowDefinitionException;
import com.opsrunner.core.model.Workflow;
import com.opsrunner.core.repository.WorkflowDefinitionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Loads workflow definitions from JSON files.
 *
 * A definition must carry {@code id}, {@code name}, {@code version} and
 * {@code steps}, and every step an {@code id} and a {@code command}. Other
 * fields default when absent.
 */
public class FileWorkflowDefinitionRepository implements WorkflowDefinitionRepository {

    private static final Logger log = LoggerFactory.getLogger(FileWorkflowDefinitionRepository.class);

    private static final List<String> REQUIRED_FIELDS = List.of("id", "name", "version", "steps");
    private static final List<String> REQUIRED_STEP_FIELDS = List.of("id", "command");

    private final Path workflowDir;
    private final ObjectMapper mapper;

    public FileWorkflowDefinitionRepository(Path workflowDir, ObjectMapper mapper) {
        this.workflowDir = workflowDir;
        this.mapper = mapper;
    }

    @Override
    public Workflow load(Path definitionPath) {
        if (!Files.isRegularFile(definitionPath)) {
            throw new WorkflowDefinitionException("Workflow file not found: " + definitionPath);
        }

        JsonNode tree;
        try {
            tree = mapper.readTree(definitionPath.toFile());
        } catch (IOException e) {
            throw new WorkflowDefinitionException(
                "Failed to parse workflow file " + definitionPath + ": " + e.getMessage(), e);
        }
        checkRequiredFields(tree, definitionPath);

        try {
            Workflow workflow = mapper.treeToValue(tree, Workflow.class);
            log.debug("Loaded workflow {} ({} steps) from {}", workflow.name(), workflow.steps().size(), definitionPath);
            return workflow;
        } catch (IOException e) {
            throw new WorkflowDefinitionException(
                "Invalid workflow definition " + definitionPath + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<Workflow> findAll() {
        if (!Files.isDirectory(workflowDir)) {
            return List.of();
        }
        List<Workflow> workflows = new ArrayList<>();
        try (Stream<Path> files = Files.list(workflowDir)) {
            for (Path path : files.filter(p -> p.toString().endsWith(".json")).sorted().toList()) {
                try {
                    workflows.add(load(path));
                } catch (WorkflowDefinitionException e) {
                    log.warn("Skipping workflow file {}: {}", path, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new WorkflowDefinitionException("Failed to list workflow directory " + workflowDir, e);
        }
        return workflows;
    }

    private void checkRequiredFields(JsonNode tree, Path definitionPath) {
        if (!tree.isObject()) {
            throw new WorkflowDefinitionException("Workflow file " + definitionPath + " is not a JSON object");
        }
        for (String field : REQUIRED_FIELDS) {
            if (!tree.hasNonNull(field)) {
                throw new WorkflowDefinitionException(
                    "Workflow file " + definitionPath + " is missing field '" + field + "'");
            }
        }
        JsonNode steps = tree.get("steps");
        if (!steps.isArray()) {
            throw new WorkflowDefinitionException("Workflow file " + definitionPath + ": 'steps' must be an array");
        }
        for (int i = 0; i < steps.size(); i++) {
            for (String field : REQUIRED_STEP_FIELDS) {
                if (!steps.get(i).hasNonNull(field)) {
                    throw new WorkflowDefinitionException(
                        "Workflow file " + definitionPath + ": step " + i + " is missing field '" + field + "'");
                }
            }
        }
    }
}
