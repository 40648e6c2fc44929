package com.cryptobot.backend.service.processor;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenBucketRateLimiterTest {

    private final AtomicLong nanos = new AtomicLong(1_000_000L);

    @Test
    void allowsBurstThenRefillsAtRate() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(10, 20, nanos::get);

        for (int i = 0; i < 20; i++) {
            assertThat(limiter.tryAcquire()).as("acquisition %d", i + 1).isTrue();
        }
        assertThat(limiter.tryAcquire()).isFalse();

        nanos.addAndGet(50_000_000L);
        assertThat(limiter.tryAcquire()).isFalse();

        nanos.addAndGet(60_000_000L);
        assertThat(limiter.tryAcquire()).isTrue();
        assertThat(limiter.tryAcquire()).isFalse();
    }

    @Test
    void neverAccumulatesBeyondBurst() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(10, 5, nanos::get);

        nanos.addAndGet(60_000_000_000L);

        assertThat(limiter.availableTokens()).isEqualTo(5.0);
        int granted = 0;
        while (limiter.tryAcquire()) {
            granted++;
        }
        assertThat(granted).isEqualTo(5);
    }

    @Test
    void rejectsNonsenseConfiguration() {
        assertThatThrownBy(() -> new TokenBucketRateLimiter(0, 5, nanos::get))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TokenBucketRateLimiter(1, 0.5, nanos::get))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
