package com.fature.cpa.application.service;

import java.time.Duration;
import java.util.Optional;

/**
 * Reconnect schedule for the remote cache transport.
 * Delay grows linearly with the attempt number up to a cap; the policy gives up
 * after a maximum number of attempts or once the total retry time is exhausted.
 */
public class BackoffPolicy {

    public static final Duration DEFAULT_STEP = Duration.ofMillis(100);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofMillis(3000);
    public static final int DEFAULT_MAX_ATTEMPTS = 10;
    public static final Duration DEFAULT_MAX_ELAPSED = Duration.ofHours(1);

    private final Duration step;
    private final Duration maxDelay;
    private final int maxAttempts;
    private final Duration maxElapsed;

    public BackoffPolicy(Duration step, Duration maxDelay, int maxAttempts, Duration maxElapsed) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got: " + maxAttempts);
        }
        this.step = step;
        this.maxDelay = maxDelay;
        this.maxAttempts = maxAttempts;
        this.maxElapsed = maxElapsed;
    }

    public static BackoffPolicy defaults() {
        return new BackoffPolicy(DEFAULT_STEP, DEFAULT_MAX_DELAY, DEFAULT_MAX_ATTEMPTS, DEFAULT_MAX_ELAPSED);
    }

    /**
     * @param attempt 1-based number of the reconnect attempt about to be made
     * @param elapsed time spent retrying so far
     * @return the delay before that attempt, or empty to give up
     */
    public Optional<Duration> nextDelay(int attempt, Duration elapsed) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be at least 1, got: " + attempt);
        }
        if (attempt > maxAttempts || elapsed.compareTo(maxElapsed) > 0) {
            return Optional.empty();
        }
        Duration delay = step.multipliedBy(attempt);
        return Optional.of(delay.compareTo(maxDelay) > 0 ? maxDelay : delay);
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
