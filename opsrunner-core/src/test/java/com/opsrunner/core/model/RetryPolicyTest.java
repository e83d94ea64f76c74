package com.opsrunner.core.model;

import org.junit.jupiter.api.Test;
import java.time.Duration;
import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void defaultPolicy_shouldHaveReasonableDefaults() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();

        assertEquals(3, policy.maxRetries());
        assertEquals(Duration.ofSeconds(1), policy.backoffUnit());
        assertNull(policy.maxBackoff());
        assertEquals(4, policy.maxInvocations());
    }

    @Test
    void computeBackoff_shouldDoubleWithAttemptIndex() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();

        // 2^attempt seconds
        assertEquals(Duration.ofSeconds(2), policy.computeBackoff(1));
        assertEquals(Duration.ofSeconds(4), policy.computeBackoff(2));
        assertEquals(Duration.ofSeconds(8), policy.computeBackoff(3));
    }

    @Test
    void computeBackoff_withoutCap_shouldKeepGrowing() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();

        assertEquals(Duration.ofSeconds(1024), policy.computeBackoff(10));
    }

    @Test
    void computeBackoff_shouldRespectMaxBackoff() {
        RetryPolicy policy = RetryPolicy.builder()
            .maxRetries(10)
            .backoffUnit(Duration.ofSeconds(1))
            .maxBackoff(Duration.ofSeconds(10))
            .build();

        // Attempt 5: 2^5 = 32s, but capped at 10s
        assertEquals(Duration.ofSeconds(10), policy.computeBackoff(5));
    }

    @Test
    void computeBackoff_shouldSaturateOnHugeAttempts() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();

        assertEquals(Duration.ofMillis(Long.MAX_VALUE), policy.computeBackoff(200));
    }

    @Test
    void computeBackoff_shouldRejectFirstTry() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();

        assertThrows(IllegalArgumentException.class, () -> policy.computeBackoff(0));
    }

    @Test
    void hasMoreAttempts_shouldAllowMaxRetriesAfterFirstTry() {
        RetryPolicy policy = RetryPolicy.builder()
            .maxRetries(2)
            .build();

        assertTrue(policy.hasMoreAttempts(0));
        assertTrue(policy.hasMoreAttempts(1));
        assertFalse(policy.hasMoreAttempts(2));
    }

    @Test
    void noRetry_shouldOnlyAllowOneAttempt() {
        RetryPolicy policy = RetryPolicy.noRetry();

        assertEquals(0, policy.maxRetries());
        assertEquals(1, policy.maxInvocations());
        assertFalse(policy.hasMoreAttempts(0));
    }

    @Test
    void withMaxRetries_shouldKeepBackoffShape() {
        RetryPolicy policy = RetryPolicy.builder()
            .backoffUnit(Duration.ofMillis(5))
            .maxBackoff(Duration.ofMillis(50))
            .build()
            .withMaxRetries(7);

        assertEquals(7, policy.maxRetries());
        assertEquals(Duration.ofMillis(5), policy.backoffUnit());
        assertEquals(Duration.ofMillis(50), policy.maxBackoff());
    }

    @Test
    void constructor_shouldRejectNegativeRetries() {
        assertThrows(IllegalArgumentException.class,
            () -> new RetryPolicy(-1, Duration.ZERO, null));
    }
}
