package com.cryptobot.backend.service.processor;

import java.time.Instant;

public record CircuitBreakerState(int consecutiveFailures, Instant lastFailureAt, boolean open) {}
