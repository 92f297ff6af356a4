package com.rostra.eventbus;

import java.time.Duration;

/**
 * Tuning for an {@link EventDispatcher}.
 *
 * @param pollInterval how long the loop waits for an envelope before rechecking for stop
 * @param maxConsecutiveFailures failures in a row after which a handler is skipped for the rest of
 *     the dispatcher's life; 0 disables this
 */
public record DispatcherOptions(Duration pollInterval, int maxConsecutiveFailures) {

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);

    public DispatcherOptions {
        if (pollInterval == null) {
            pollInterval = DEFAULT_POLL_INTERVAL;
        }
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive, was " + pollInterval);
        }
        if (maxConsecutiveFailures < 0) {
            throw new IllegalArgumentException(
                    "maxConsecutiveFailures must not be negative, was " + maxConsecutiveFailures);
        }
    }

    public static DispatcherOptions defaults() {
        return new DispatcherOptions(DEFAULT_POLL_INTERVAL, 0);
    }

    public boolean circuitBreakerEnabled() {
        return maxConsecutiveFailures > 0;
    }
}
