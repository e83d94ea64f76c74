package com.opsrunner.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Informational kind of a workflow step.
 * Only the step's command and arguments are executed, whatever the kind.
 */
public enum StepType {
    @JsonProperty("Command")
    COMMAND,

    @JsonProperty("Script")
    SCRIPT,

    @JsonProperty("Upload")
    UPLOAD,

    @JsonProperty("Download")
    DOWNLOAD,

    @JsonProperty("Transform")
    TRANSFORM,

    @JsonProperty("Validate")
    VALIDATE,

    @JsonProperty("Notify")
    NOTIFY
}
