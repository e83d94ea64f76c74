package com.opsrunner.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lifecycle states of an upload as it moves through the upload pipeline.
 */
public enum ProcessingStatus {
    @JsonProperty("Pending")
    PENDING,

    @JsonProperty("Processing")
    PROCESSING,

    @JsonProperty("Completed")
    COMPLETED,

    @JsonProperty("Failed")
    FAILED,

    /**
     * Completed and moved into the archive directory.
     */
    @JsonProperty("Archived")
    ARCHIVED
}
