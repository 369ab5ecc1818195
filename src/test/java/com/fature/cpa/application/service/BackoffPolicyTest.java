package com.fature.cpa.application.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BackoffPolicyTest {

    private final BackoffPolicy policy = BackoffPolicy.defaults();

    @Test
    void nextDelay_growsLinearly() {
        assertEquals(Duration.ofMillis(100), policy.nextDelay(1, Duration.ZERO).orElseThrow());
        assertEquals(Duration.ofMillis(500), policy.nextDelay(5, Duration.ofSeconds(1)).orElseThrow());
    }

    @Test
    void nextDelay_isCapped() {
        BackoffPolicy longRunning = new BackoffPolicy(
                Duration.ofMillis(100), Duration.ofMillis(3000), 100, Duration.ofHours(1));

        assertEquals(Duration.ofMillis(3000), longRunning.nextDelay(31, Duration.ZERO).orElseThrow());
        assertEquals(Duration.ofMillis(3000), longRunning.nextDelay(90, Duration.ZERO).orElseThrow());
    }

    @Test
    void nextDelay_givesUpAfterMaxAttempts() {
        assertTrue(policy.nextDelay(10, Duration.ZERO).isPresent());
        assertTrue(policy.nextDelay(11, Duration.ZERO).isEmpty());
    }

    @Test
    void nextDelay_givesUpWhenRetryTimeExhausted() {
        assertTrue(policy.nextDelay(2, Duration.ofHours(1).plusMillis(1)).isEmpty());
    }

    @Test
    void nextDelay_rejectsAttemptZero() {
        assertThrows(IllegalArgumentException.class, () -> policy.nextDelay(0, Duration.ZERO));
    }
}
