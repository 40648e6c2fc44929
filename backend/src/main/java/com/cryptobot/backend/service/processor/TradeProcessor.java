package com.cryptobot.backend.service.processor;

import com.cryptobot.backend.exception.RiskPreconditionException;
import com.cryptobot.backend.service.MetricsService;
import com.cryptobot.backend.service.risk.RiskRejection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Serializes every trade mutation onto one consumer thread.
 * <p>
 * Each request passes the circuit breaker (settlement types excepted) and the rate limiter, then runs
 * through the registered handlers in registration order. A failing request is re-queued once after a
 * back-off; a second failure completes it as FAILED and writes a dead letter.
 * <p>
 * Stopping completes every request still queued or waiting for its re-queue as FAILED ("stopped");
 * the processor can be started again afterwards.
 */
@Slf4j
public class TradeProcessor implements SmartLifecycle {

    private static final int MAX_ATTEMPTS = 2;
    static final String STOPPED = "stopped";

    private final BlockingDeque<TradeRequest> queue;
    private final TokenBucketRateLimiter rateLimiter;
    private final TradeCircuitBreaker circuitBreaker;
    private final MetricsService metricsService;
    private final DeadLetterQueueService deadLetterQueue;
    private final Clock clock;
    private final Duration pollTimeout;
    private final Duration requeueBackoff;
    private final Duration rateLimitWait;
    private final boolean autoStartup;

    private final List<NamedHandler> handlers = new ArrayList<>();
    private final Set<TradeRequest> awaitingRequeue = ConcurrentHashMap.newKeySet();

    private volatile ScheduledExecutorService retryScheduler;
    private volatile boolean running;
    private Thread consumer;

    public TradeProcessor(int queueCapacity,
                          TokenBucketRateLimiter rateLimiter,
                          TradeCircuitBreaker circuitBreaker,
                          MetricsService metricsService,
                          DeadLetterQueueService deadLetterQueue,
                          Clock clock,
                          Duration pollTimeout,
                          Duration requeueBackoff,
                          Duration rateLimitWait,
                          boolean autoStartup) {
        this.queue = new LinkedBlockingDeque<>(queueCapacity);
        this.rateLimiter = rateLimiter;
        this.circuitBreaker = circuitBreaker;
        this.metricsService = metricsService;
        this.deadLetterQueue = deadLetterQueue;
        this.clock = clock;
        this.pollTimeout = pollTimeout;
        this.requeueBackoff = requeueBackoff;
        this.rateLimitWait = rateLimitWait;
        this.autoStartup = autoStartup;
        metricsService.registerQueueDepth(queue::size);
    }

    public synchronized void registerHandler(String name, TradeHandler handler) {
        if (running) {
            throw new IllegalStateException("Handlers must be registered before the processor starts");
        }
        handlers.add(new NamedHandler(name, handler));
        log.info("Registered trade handler '{}'", name);
    }

    /**
     * @return false when the queue is full; the request's outcome is then completed as FAILED
     */
    public boolean enqueue(TradeRequest request) {
        request.markEnqueued(clock.instant());
        if (!queue.offerLast(request)) {
            log.warn("Trade queue full, dropping {}", request.describe());
            complete(request, TradeOutcome.Status.FAILED, null, "queue_full");
            return false;
        }
        return true;
    }

    public int queueDepth() {
        return queue.size();
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        retryScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "trade-requeue");
            t.setDaemon(true);
            return t;
        });
        consumer = new Thread(this::runLoop, "trade-processor");
        consumer.setDaemon(true);
        consumer.start();
        log.info("Trade processor started with {} handler(s)", handlers.size());
    }

    /**
     * Lets the in-flight request finish; the consumer exits on its next poll. Requests left behind
     * are completed as FAILED.
     */
    @Override
    public void stop() {
        Thread worker;
        ScheduledExecutorService scheduler;
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            worker = consumer;
            scheduler = retryScheduler;
        }
        if (worker != null && worker != Thread.currentThread()) {
            try {
                worker.join(pollTimeout.toMillis() * 4 + 1_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(pollTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        List<TradeRequest> abandoned = new ArrayList<>(awaitingRequeue);
        awaitingRequeue.clear();
        queue.drainTo(abandoned);
        for (TradeRequest request : abandoned) {
            complete(request, TradeOutcome.Status.FAILED, null, STOPPED);
        }
        if (abandoned.isEmpty()) {
            log.info("Trade processor stopped");
        } else {
            log.warn("Trade processor stopped, failed {} unprocessed request(s)", abandoned.size());
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    private void runLoop() {
        while (running) {
            TradeRequest request;
            try {
                request = queue.pollFirst(pollTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (request == null) {
                continue;
            }
            try {
                process(request);
            } catch (RuntimeException e) {
                log.error("Unexpected error while processing {}", request.describe(), e);
                complete(request, TradeOutcome.Status.FAILED, null, e.getMessage());
            }
        }
    }

    /**
     * Runs one request through the gates and handlers on the calling thread.
     */
    void process(TradeRequest request) {
        if (request.getType().isGatedByCircuit() && !circuitBreaker.canExecute()) {
            request.reject(RiskRejection.CIRCUIT_OPEN, "Circuit breaker open");
            metricsService.recordReject(RiskRejection.CIRCUIT_OPEN.code());
            log.warn("Circuit open, rejecting {}", request.describe());
            complete(request, TradeOutcome.Status.REJECTED, RiskRejection.CIRCUIT_OPEN, "Circuit breaker open");
            return;
        }

        if (!rateLimiter.tryAcquire()) {
            log.debug("Rate limited, deferring {}", request.describe());
            pause(rateLimitWait);
            if (!queue.offerFirst(request)) {
                log.warn("Trade queue full while deferring {}", request.describe());
                complete(request, TradeOutcome.Status.FAILED, null, "queue_full");
            }
            return;
        }

        int attempt = request.beginAttempt();
        try {
            for (NamedHandler entry : snapshotHandlers()) {
                entry.handler().handle(request);
            }
        } catch (RiskPreconditionException e) {
            // broken request, retrying cannot help
            log.error("Precondition violated by {}: {}", request.describe(), e.getMessage());
            metricsService.recordRequestFailed();
            deadLetterQueue.logFailure(request.getType().name(), request.describe(), e.getMessage());
            complete(request, TradeOutcome.Status.FAILED, null, e.getMessage());
            return;
        } catch (Exception e) {
            onFailure(request, attempt, e);
            return;
        }

        circuitBreaker.recordSuccess();
        metricsService.recordRequestProcessed();
        if (request.isRejected()) {
            complete(request, TradeOutcome.Status.REJECTED, request.getRejection(), request.getRejectionDetail());
        } else {
            complete(request, TradeOutcome.Status.SUCCEEDED, null, null);
        }
    }

    private void onFailure(TradeRequest request, int attempt, Exception error) {
        if (circuitBreaker.recordFailure()) {
            metricsService.recordCircuitTrip();
        }
        metricsService.recordRequestFailed();

        ScheduledExecutorService scheduler = retryScheduler;
        if (attempt < MAX_ATTEMPTS && scheduler != null) {
            log.warn("Trade request {} failed (attempt {}), re-queueing in {}ms: {}",
                    request.describe(), attempt, requeueBackoff.toMillis(), error.getMessage());
            awaitingRequeue.add(request);
            try {
                scheduler.schedule(() -> requeue(request, error), requeueBackoff.toMillis(), TimeUnit.MILLISECONDS);
                return;
            } catch (RejectedExecutionException e) {
                awaitingRequeue.remove(request);
                log.warn("Re-queue scheduler shut down, giving up on {}", request.describe());
            }
        }

        log.error("Trade request {} failed after {} attempt(s), queued since {}",
                request.describe(), attempt, request.getEnqueuedAt(), error);
        deadLetterQueue.logFailure(request.getType().name(), request.describe(), error.getMessage());
        complete(request, TradeOutcome.Status.FAILED, null, error.getMessage());
    }

    private void requeue(TradeRequest request, Exception previousError) {
        if (!awaitingRequeue.remove(request)) {
            return;
        }
        if (!queue.offerLast(request)) {
            deadLetterQueue.logFailure(request.getType().name(), request.describe(), previousError.getMessage());
            complete(request, TradeOutcome.Status.FAILED, null, "queue_full");
        }
    }

    private synchronized List<NamedHandler> snapshotHandlers() {
        return List.copyOf(handlers);
    }

    private void pause(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void complete(TradeRequest request, TradeOutcome.Status status, RiskRejection rejection, String detail) {
        request.getOutcome().complete(new TradeOutcome(request.getId(), status, request.getOrderId(), rejection, detail));
    }

    private record NamedHandler(String name, TradeHandler handler) {}
}
