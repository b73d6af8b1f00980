package com.example.navernewscrawling.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {

    @Test
    void maxAttemptsIsOnePlusRetryCount() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(10));

        assertEquals(4, policy.maxAttempts());
        assertTrue(policy.hasAttemptsLeft(3));
        assertFalse(policy.hasAttemptsLeft(4));
    }

    @Test
    void zeroRetriesMeansSingleAttempt() {
        RetryPolicy policy = new RetryPolicy(0, Duration.ZERO, Duration.ZERO);

        assertFalse(policy.hasAttemptsLeft(1));
    }

    @Test
    void backoffDoublesUpToCap() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ofSeconds(2), Duration.ofSeconds(5));

        assertEquals(Duration.ofSeconds(2), policy.backoffFor(1));
        assertEquals(Duration.ofSeconds(4), policy.backoffFor(2));
        assertEquals(Duration.ofSeconds(5), policy.backoffFor(3));
    }

    @Test
    void interruptedSleepThrows() {
        RetryPolicy policy = new RetryPolicy(1, Duration.ZERO, Duration.ZERO);
        Thread.currentThread().interrupt();

        assertThrows(InterruptedException.class, () -> policy.sleepBeforeRetry(1));
        assertFalse(Thread.currentThread().isInterrupted());
    }
}
