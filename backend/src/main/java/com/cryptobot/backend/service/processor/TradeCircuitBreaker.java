package com.cryptobot.backend.service.processor;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Failure-count gate for the trade pipeline.
 * <p>
 * Failures older than {@code resetTimeout} do not accumulate. Once {@code failureThreshold} failures
 * land inside the window the breaker opens and rejects work until {@code resetTimeout} has passed since
 * the last failure; the first {@link #canExecute()} after that closes it and clears the count.
 */
@Slf4j
public class TradeCircuitBreaker {

    private final int failureThreshold;
    private final Duration resetTimeout;
    private final Clock clock;

    private int failures;
    private Instant lastFailureAt;
    private boolean open;

    public TradeCircuitBreaker(int failureThreshold, Duration resetTimeout, Clock clock) {
        this.failureThreshold = failureThreshold;
        this.resetTimeout = resetTimeout;
        this.clock = clock;
    }

    /**
     * @return true when this failure tripped the breaker open
     */
    public synchronized boolean recordFailure() {
        Instant now = clock.instant();
        if (lastFailureAt != null && Duration.between(lastFailureAt, now).compareTo(resetTimeout) > 0) {
            failures = 0;
        }
        failures++;
        lastFailureAt = now;

        if (!open && failures >= failureThreshold) {
            open = true;
            log.warn("⛔ Circuit breaker opened after {} failures", failures);
            return true;
        }
        return false;
    }

    public synchronized void recordSuccess() {
        if (!open) {
            failures = 0;
        }
    }

    public synchronized boolean canExecute() {
        if (!open) {
            return true;
        }
        if (Duration.between(lastFailureAt, clock.instant()).compareTo(resetTimeout) >= 0) {
            open = false;
            failures = 0;
            log.info("Circuit breaker reset after {}s cooldown", resetTimeout.toSeconds());
            return true;
        }
        return false;
    }

    public synchronized CircuitBreakerState state() {
        return new CircuitBreakerState(failures, lastFailureAt, open);
    }
}
