package com.cryptobot.backend.service.processor;

import com.cryptobot.backend.service.MetricsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps trade requests that exhausted their retry in memory for inspection.
 */
@Slf4j
@RequiredArgsConstructor
public class DeadLetterQueueService {

    private final MetricsService metricsService;
    private final Clock clock;
    private final List<FailedOperation> entries = Collections.synchronizedList(new ArrayList<>());

    public void logFailure(String type, String details, String error) {
        log.error("💀 DLQ Entry: [{}] {} -> {}", type, details, error);
        entries.add(new FailedOperation(type, details, error, clock.instant()));
        metricsService.recordDeadLetter();
    }

    public List<FailedOperation> entries() {
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }

    public record FailedOperation(String operationType, String details, String errorMessage, Instant timestamp) {}
}
