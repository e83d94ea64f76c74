package com.opsrunner.core.model;

import org.junit.jupiter.api.Test;
import java.time.Duration;
import static org.junit.jupiter.api.Assertions.*;

class WorkflowStepTest {

    @Test
    void negativeRetryCount_shouldBeRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> WorkflowStep.builder().id("fetch").command("curl").retryCount(-1).build());

        assertTrue(e.getMessage().contains("step 'fetch'"));
    }

    @Test
    void nonPositiveTimeout_shouldBeRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> WorkflowStep.builder().id("s").command("sleep").timeout(0L).build());
        assertThrows(IllegalArgumentException.class,
            () -> WorkflowStep.builder().id("s").command("sleep").timeout(-5L).build());
    }

    @Test
    void timeoutBeyondMillisecondRange_shouldBeRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> WorkflowStep.builder().id("s").command("sleep").timeout(Long.MAX_VALUE).build());
    }

    @Test
    void largestTimeout_shouldConvertToMillis() {
        WorkflowStep step = WorkflowStep.builder().id("s").command("sleep")
            .timeout(WorkflowStep.MAX_TIMEOUT_SECONDS).build();

        Duration timeout = step.effectiveTimeout(Duration.ofHours(1));
        assertEquals(WorkflowStep.MAX_TIMEOUT_SECONDS * 1000, timeout.toMillis());
    }

    @Test
    void zeroRetryCount_shouldOverrideDefault() {
        WorkflowStep step = WorkflowStep.builder().id("s").command("true").retryCount(0).build();

        assertEquals(0, step.effectiveRetryPolicy(RetryPolicy.defaultPolicy()).maxRetries());
    }
}
