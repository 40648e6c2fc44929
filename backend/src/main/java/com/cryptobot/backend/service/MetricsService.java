package com.cryptobot.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.stream.Collectors;

@Service
@Slf4j
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private final AtomicLong tradesExecuted = new AtomicLong();
    private final AtomicLong circuitTrips = new AtomicLong();
    private final ConcurrentHashMap<String, AtomicLong> rejectsByReason = new ConcurrentHashMap<>();

    private final Counter tradesExecutedCounter;
    private final Counter ordersPlacedCounter;
    private final Counter requestsProcessedCounter;
    private final Counter requestsFailedCounter;
    private final Counter circuitTripsCounter;
    private final Counter deadLettersCounter;

    public MetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.tradesExecutedCounter = Counter.builder("trades_executed_total").register(meterRegistry);
        this.ordersPlacedCounter = Counter.builder("orders_placed_total").register(meterRegistry);
        this.requestsProcessedCounter = Counter.builder("trade_requests_processed_total").register(meterRegistry);
        this.requestsFailedCounter = Counter.builder("trade_requests_failed_total").register(meterRegistry);
        this.circuitTripsCounter = Counter.builder("circuit_breaker_trips_total").register(meterRegistry);
        this.deadLettersCounter = Counter.builder("trade_dead_letters_total").register(meterRegistry);
    }

    public void registerQueueDepth(Supplier<Number> depth) {
        Gauge.builder("trade_queue_size", depth)
                .strongReference(true)
                .register(meterRegistry);
    }

    public void recordTradeExecuted() {
        tradesExecuted.incrementAndGet();
        tradesExecutedCounter.increment();
    }

    public void recordOrderPlaced() {
        ordersPlacedCounter.increment();
    }

    public void recordRequestProcessed() {
        requestsProcessedCounter.increment();
    }

    public void recordRequestFailed() {
        requestsFailedCounter.increment();
    }

    public void recordCircuitTrip() {
        circuitTrips.incrementAndGet();
        circuitTripsCounter.increment();
    }

    public void recordDeadLetter() {
        deadLettersCounter.increment();
    }

    public void recordReject(String reason) {
        String tag = reason == null ? "unknown" : reason;
        rejectsByReason.computeIfAbsent(tag, key -> new AtomicLong()).incrementAndGet();
        Counter.builder("trades_rejected_total")
                .tag("reason", tag)
                .register(meterRegistry)
                .increment();
    }

    public long tradesExecuted() {
        return tradesExecuted.get();
    }

    public long circuitTrips() {
        return circuitTrips.get();
    }

    public Map<String, Long> rejectCounts() {
        return rejectsByReason.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, entry -> entry.getValue().get()));
    }
}
