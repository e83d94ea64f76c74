package com.opsrunner.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;
import java.util.List;

/**
 * Definition of a step within a workflow.
 * Describes what to execute, not run-specific data.
 *
 * Invariants:
 * - id is non-empty and unique within the workflow
 * - every dependsOn entry names another step of the same workflow
 * - timeout, when set, is > 0 seconds and fits in a millisecond count
 * - retryCount, when set, is >= 0
 */
public record WorkflowStep(
    // Identity
    String id,
    String name,
    @JsonProperty("step_type") StepType stepType,

    // Execution
    String command,
    List<String> args,
    Long timeout,
    @JsonProperty("retry_count") Integer retryCount,

    // Graph
    @JsonProperty("depends_on") List<String> dependsOn,

    // Conditional execution ("$flag" style substitution)
    String condition,

    // Informational: captured output is not written back into the variables
    String output
) {
    /**
     * Largest timeout, in seconds, whose millisecond value still fits in a long.
     */
    public static final long MAX_TIMEOUT_SECONDS = Long.MAX_VALUE / 1000;

    public WorkflowStep {
        if (timeout != null && (timeout <= 0 || timeout > MAX_TIMEOUT_SECONDS)) {
            throw new IllegalArgumentException(
                "step '" + id + "': timeout must be between 1 and " + MAX_TIMEOUT_SECONDS + " seconds, got " + timeout);
        }
        if (retryCount != null && retryCount < 0) {
            throw new IllegalArgumentException("step '" + id + "': retry_count must be >= 0, got " + retryCount);
        }
        args = args == null ? List.of() : List.copyOf(args);
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        stepType = stepType == null ? StepType.COMMAND : stepType;
    }

    /**
     * Check if this step has a condition expression.
     */
    @JsonIgnore
    public boolean isConditional() {
        return condition != null && !condition.isEmpty();
    }

    /**
     * Get the effective timeout (step-specific or workflow default).
     */
    public Duration effectiveTimeout(Duration workflowDefault) {
        return timeout != null ? Duration.ofSeconds(timeout) : workflowDefault;
    }

    /**
     * Get the effective retry policy (step-specific retry count or workflow default).
     */
    public RetryPolicy effectiveRetryPolicy(RetryPolicy workflowDefault) {
        return retryCount != null ? workflowDefault.withMaxRetries(retryCount) : workflowDefault;
    }

    /**
     * Builder for WorkflowStep.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String name;
        private StepType stepType = StepType.COMMAND;
        private String command;
        private List<String> args = List.of();
        private Long timeout;
        private Integer retryCount;
        private List<String> dependsOn = List.of();
        private String condition;
        private String output;

        public Builder id(String id) {
            this.id = id;
            if (this.name == null) {
                this.name = id;
            }
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder stepType(StepType stepType) {
            this.stepType = stepType;
            return this;
        }

        public Builder command(String command, String... args) {
            this.command = command;
            this.args = List.of(args);
            return this;
        }

        public Builder args(List<String> args) {
            this.args = args;
            return this;
        }

        public Builder timeout(Long timeoutSeconds) {
            this.timeout = timeoutSeconds;
            return this;
        }

        public Builder retryCount(Integer retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder dependsOn(String... stepIds) {
            this.dependsOn = List.of(stepIds);
            return this;
        }

        public Builder condition(String condition) {
            this.condition = condition;
            return this;
        }

        public Builder output(String output) {
            this.output = output;
            return this;
        }

        public WorkflowStep build() {
            return new WorkflowStep(
                id, name, stepType, command, args, timeout,
                retryCount, dependsOn, condition, output
            );
        }
    }
}
