package com.opsrunner.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Descriptive metadata attached to a workflow definition.
 */
public record WorkflowMetadata(
    String author,
    List<String> tags,
    WorkflowPriority priority,
    @JsonProperty("estimated_duration") Long estimatedDuration,
    @JsonProperty("resource_requirements") ResourceRequirements resourceRequirements
) {
    public WorkflowMetadata {
        tags = tags == null ? List.of() : List.copyOf(tags);
        priority = priority == null ? WorkflowPriority.NORMAL : priority;
        resourceRequirements = resourceRequirements == null ? ResourceRequirements.none() : resourceRequirements;
    }

    public static WorkflowMetadata empty() {
        return new WorkflowMetadata(null, List.of(), WorkflowPriority.NORMAL, null, ResourceRequirements.none());
    }
}
