package com.opsrunner.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable definition of a workflow, loaded from one JSON file.
 *
 * Invariants:
 * - step ids are unique
 * - every step dependency names a step of this workflow
 * - the dependency graph is acyclic (DAG)
 */
public record Workflow(
    // Identity
    UUID id,
    String name,
    String description,
    String version,
    @JsonProperty("created_at") Instant createdAt,

    // Graph structure
    List<WorkflowStep> steps,

    // Shared environment for step commands and conditions
    Map<String, String> variables,

    // Metadata
    WorkflowMetadata metadata
) {
    public Workflow {
        steps = steps == null ? List.of() : List.copyOf(steps);
        variables = variables == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        metadata = metadata == null ? WorkflowMetadata.empty() : metadata;
    }

    /**
     * Builder for Workflow.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private UUID id = UUID.randomUUID();
        private String name;
        private String description;
        private String version = "1.0.0";
        private Instant createdAt = Instant.now();
        private List<WorkflowStep> steps = List.of();
        private Map<String, String> variables = Map.of();
        private WorkflowMetadata metadata = WorkflowMetadata.empty();

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder steps(List<WorkflowStep> steps) {
            this.steps = steps;
            return this;
        }

        public Builder steps(WorkflowStep... steps) {
            this.steps = List.of(steps);
            return this;
        }

        public Builder variables(Map<String, String> variables) {
            this.variables = variables;
            return this;
        }

        public Builder metadata(WorkflowMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public Workflow build() {
            return new Workflow(
                id, name, description, version, createdAt,
                steps, variables, metadata
            );
        }
    }
}
