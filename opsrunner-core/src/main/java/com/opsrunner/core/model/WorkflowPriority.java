package com.opsrunner.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Operator-assigned priority of a workflow. Informational.
 */
public enum WorkflowPriority {
    @JsonProperty("Low")
    LOW,

    @JsonProperty("Normal")
    NORMAL,

    @JsonProperty("High")
    HIGH,

    @JsonProperty("Critical")
    CRITICAL
}
