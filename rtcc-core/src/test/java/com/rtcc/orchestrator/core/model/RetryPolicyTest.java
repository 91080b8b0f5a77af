package com.rtcc.orchestrator.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void defaultPolicy_shouldMatchAllocationRetryDefaults() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();

        assertEquals(5, policy.maxAttempts());
        assertEquals(Duration.ofMillis(200), policy.initialBackoff());
        assertEquals(Duration.ofSeconds(5), policy.maxBackoff());
        assertEquals(2.0, policy.backoffMultiplier());
    }

    @Test
    void computeBackoff_shouldIncreaseExponentially() {
        RetryPolicy policy = RetryPolicy.builder()
            .initialBackoff(Duration.ofMillis(100))
            .maxBackoff(Duration.ofSeconds(10))
            .backoffMultiplier(2.0)
            .jitterFactor(0.0)
            .build();

        assertEquals(Duration.ofMillis(100), policy.computeBackoff(1));
        assertEquals(Duration.ofMillis(200), policy.computeBackoff(2));
        assertEquals(Duration.ofMillis(400), policy.computeBackoff(3));
    }

    @Test
    void computeBackoff_shouldRespectMaxBackoff() {
        RetryPolicy policy = RetryPolicy.builder()
            .maxAttempts(10)
            .initialBackoff(Duration.ofSeconds(1))
            .maxBackoff(Duration.ofSeconds(10))
            .jitterFactor(0.0)
            .build();

        // 2^4 = 16s, capped at 10s
        assertEquals(Duration.ofSeconds(10), policy.computeBackoff(5));
    }

    @Test
    void computeBackoff_withJitter_shouldStayWithinRange() {
        RetryPolicy policy = RetryPolicy.builder()
            .initialBackoff(Duration.ofSeconds(1))
            .maxBackoff(Duration.ofSeconds(10))
            .jitterFactor(0.1)
            .build();

        for (int i = 0; i < 100; i++) {
            long millis = policy.computeBackoff(1).toMillis();
            assertTrue(millis >= 900 && millis <= 1100, "backoff " + millis);
        }
    }

    @Test
    void computeBackoff_shouldRejectNonPositiveAttempt() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.defaultPolicy().computeBackoff(0));
    }

    @Test
    void hasMoreAttempts_shouldRespectMaxAttempts() {
        RetryPolicy policy = RetryPolicy.builder().maxAttempts(3).build();

        assertTrue(policy.hasMoreAttempts(1));
        assertTrue(policy.hasMoreAttempts(2));
        assertFalse(policy.hasMoreAttempts(3));
    }

    @Test
    void noRetry_shouldAllowSingleAttempt() {
        assertFalse(RetryPolicy.noRetry().hasMoreAttempts(1));
    }

    @Test
    void constructor_shouldRejectInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().maxAttempts(0).build());
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().backoffMultiplier(0.5).build());
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder()
            .initialBackoff(Duration.ofSeconds(10))
            .maxBackoff(Duration.ofSeconds(1))
            .build());
    }
}
