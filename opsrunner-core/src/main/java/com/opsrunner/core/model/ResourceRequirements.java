package com.opsrunner.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Resource hints declared by a workflow. Not enforced.
 */
public record ResourceRequirements(
    @JsonProperty("cpu_cores") int cpuCores,
    @JsonProperty("memory_mb") int memoryMb,
    @JsonProperty("disk_space_mb") int diskSpaceMb
) {
    public static ResourceRequirements none() {
        return new ResourceRequirements(0, 0, 0);
    }
}
