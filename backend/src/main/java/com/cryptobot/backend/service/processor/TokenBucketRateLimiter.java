package com.cryptobot.backend.service.processor;

import java.util.function.LongSupplier;

/**
 * Token bucket: refills at {@code rate} permits per second up to {@code burst}. Starts full.
 */
public class TokenBucketRateLimiter {

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final double rate;
    private final double burst;
    private final LongSupplier nanoTicker;

    private double tokens;
    private long lastRefillNanos;

    public TokenBucketRateLimiter(double rate, double burst, LongSupplier nanoTicker) {
        if (rate <= 0 || burst < 1) {
            throw new IllegalArgumentException("rate must be positive and burst at least 1");
        }
        this.rate = rate;
        this.burst = burst;
        this.nanoTicker = nanoTicker;
        this.tokens = burst;
        this.lastRefillNanos = nanoTicker.getAsLong();
    }

    public TokenBucketRateLimiter(double rate, double burst) {
        this(rate, burst, System::nanoTime);
    }

    public synchronized boolean tryAcquire() {
        refill();
        if (tokens >= 1) {
            tokens -= 1;
            return true;
        }
        return false;
    }

    public synchronized double availableTokens() {
        refill();
        return tokens;
    }

    private void refill() {
        long now = nanoTicker.getAsLong();
        double elapsedSeconds = (now - lastRefillNanos) / NANOS_PER_SECOND;
        if (elapsedSeconds > 0) {
            tokens = Math.min(burst, tokens + elapsedSeconds * rate);
            lastRefillNanos = now;
        }
    }
}
