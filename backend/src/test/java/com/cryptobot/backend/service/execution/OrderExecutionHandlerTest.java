package com.cryptobot.backend.service.execution;

import com.cryptobot.backend.exception.ExecutionFailureException;
import com.cryptobot.backend.model.OrderAction;
import com.cryptobot.backend.model.OrderStatus;
import com.cryptobot.backend.model.PositionSide;
import com.cryptobot.backend.model.RiskLimits;
import com.cryptobot.backend.service.MetricsService;
import com.cryptobot.backend.service.TradeRecorder;
import com.cryptobot.backend.service.processor.TradeRequest;
import com.cryptobot.backend.service.processor.TradeRequestType;
import com.cryptobot.backend.service.risk.DefaultRiskManager;
import com.cryptobot.backend.service.risk.RiskRejection;
import com.cryptobot.backend.util.MutableClock;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OrderExecutionHandlerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-02-01T09:00:00Z"));
    private final DefaultRiskManager riskManager = new DefaultRiskManager(RiskLimits.builder().build(), 1000.0, clock);
    private final OrderExecutor executor = new OrderExecutor(riskManager, new OrderStateMachine(clock),
            mock(TradeRecorder.class), new MetricsService(new SimpleMeterRegistry()), clock,
            0.001, Duration.ofSeconds(60), 0.0);
    private final Retry retry = Retry.of("test", RetryConfig.custom()
            .maxAttempts(3)
            .waitDuration(Duration.ofMillis(1))
            .build());
    private final List<TradeRequest> queued = new CopyOnWriteArrayList<>();

    private OrderExecutionHandler handler(TradeTransport transport) {
        return new OrderExecutionHandler(executor, transport, retry, queued::add);
    }

    @Test
    void submittedOrderQueuesFillFromTransport() {
        OrderExecutionHandler handler = handler(new PaperTradeTransport(clock));
        TradeRequest request = TradeRequest.open("SOL", PositionSide.LONG, 100, 1, 95.0, null);

        handler.handle(request);

        assertThat(request.isRejected()).isFalse();
        assertThat(request.getOrderId()).isNotNull();
        assertThat(queued).hasSize(1);
        TradeRequest fill = queued.get(0);
        assertThat(fill.getType()).isEqualTo(TradeRequestType.FILL);
        assertThat(fill.getOrderId()).isEqualTo(request.getOrderId());

        handler.handle(fill);

        assertThat(executor.getOrder(request.getOrderId()).orElseThrow().getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(riskManager.getPosition("SOL")).isPresent();
    }

    @Test
    void riskRefusalIsReportedOnTheRequest() {
        OrderExecutionHandler handler = handler(new PaperTradeTransport(clock));
        TradeRequest request = TradeRequest.close("SOL", 100, "signal");

        handler.handle(request);

        assertThat(request.getRejection()).isEqualTo(RiskRejection.NO_POSITION);
        assertThat(queued).isEmpty();
    }

    @Test
    void transientTransportErrorsAreRetried() {
        TradeTransport transport = mock(TradeTransport.class);
        Quote quote = new Quote("q", "SOL", PositionSide.LONG, OrderAction.OPEN, 1, 100, clock.instant());
        when(transport.getQuote(anyString(), anyString(), any(), any(), anyDouble(), anyDouble())).thenReturn(quote);
        when(transport.submit(quote))
                .thenThrow(new IllegalStateException("503"))
                .thenThrow(new IllegalStateException("503"))
                .thenReturn(new OrderHandle("q", new CompletableFuture<>()));
        OrderExecutionHandler handler = handler(transport);

        handler.handle(TradeRequest.open("SOL", PositionSide.LONG, 100, 1, 95.0, null));

        verify(transport, times(3)).submit(quote);
        assertThat(executor.pendingOrders()).hasSize(1);
    }

    @Test
    void exhaustedTransportMarksOrderFailed() {
        TradeTransport transport = mock(TradeTransport.class);
        when(transport.getQuote(anyString(), anyString(), any(), any(), anyDouble(), anyDouble()))
                .thenThrow(new IllegalStateException("connection refused"));
        OrderExecutionHandler handler = handler(transport);
        TradeRequest request = TradeRequest.open("SOL", PositionSide.LONG, 100, 1, 95.0, null);

        assertThatThrownBy(() -> handler.handle(request))
                .isInstanceOf(ExecutionFailureException.class)
                .hasCauseInstanceOf(IllegalStateException.class);

        assertThat(executor.getOrder(request.getOrderId()).orElseThrow().getStatus()).isEqualTo(OrderStatus.FAILED);
        assertThat(executor.pendingOrders()).isEmpty();
    }

    @Test
    void failedFillFutureQueuesFailureNotice() {
        TradeTransport transport = mock(TradeTransport.class);
        CompletableFuture<FillNotification> fill = new CompletableFuture<>();
        when(transport.getQuote(anyString(), anyString(), any(), any(), anyDouble(), anyDouble()))
                .thenAnswer(invocation -> new Quote(invocation.getArgument(0), "SOL", PositionSide.LONG,
                        OrderAction.OPEN, 1, 100, clock.instant()));
        when(transport.submit(any())).thenAnswer(invocation -> new OrderHandle("x", fill));
        OrderExecutionHandler handler = handler(transport);
        TradeRequest request = TradeRequest.open("SOL", PositionSide.LONG, 100, 1, 95.0, null);
        handler.handle(request);

        fill.completeExceptionally(new IllegalStateException("order expired"));

        assertThat(queued).hasSize(1);
        TradeRequest notice = queued.get(0);
        assertThat(notice.getType()).isEqualTo(TradeRequestType.FILL_FAILED);
        assertThat(notice.getReason()).isEqualTo("order expired");

        handler.handle(notice);
        assertThat(executor.getOrder(request.getOrderId()).orElseThrow().getStatus()).isEqualTo(OrderStatus.FAILED);
    }

    @Test
    void cancelOfFinishedOrderIsRefused() {
        OrderExecutionHandler handler = handler(new PaperTradeTransport(clock));
        TradeRequest cancel = TradeRequest.cancel("missing");

        handler.handle(cancel);

        assertThat(cancel.getRejection()).isEqualTo(RiskRejection.INVALID_ORDER);
    }
}
