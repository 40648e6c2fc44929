package com.cryptobot.backend.service.execution;

import com.cryptobot.backend.exception.RiskPreconditionException;
import com.cryptobot.backend.model.ClosedTrade;
import com.cryptobot.backend.model.Order;
import com.cryptobot.backend.model.OrderAction;
import com.cryptobot.backend.model.OrderStatus;
import com.cryptobot.backend.model.PositionSide;
import com.cryptobot.backend.model.RiskLimits;
import com.cryptobot.backend.service.MetricsService;
import com.cryptobot.backend.service.TradeRecorder;
import com.cryptobot.backend.service.risk.DefaultRiskManager;
import com.cryptobot.backend.service.risk.RiskRejection;
import com.cryptobot.backend.util.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class OrderExecutorTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-02-01T09:00:00Z"));
    private final DefaultRiskManager riskManager = new DefaultRiskManager(RiskLimits.builder().build(), 1000.0, clock);
    private final TradeRecorder recorder = mock(TradeRecorder.class);
    private final MetricsService metrics = new MetricsService(new SimpleMeterRegistry());
    private final OrderExecutor executor = new OrderExecutor(riskManager, new OrderStateMachine(clock), recorder,
            metrics, clock, 0.001, Duration.ofSeconds(60), 0.0);

    private static OrderRequest open(String symbol, double price, double size) {
        return OrderRequest.builder()
                .symbol(symbol)
                .side(PositionSide.LONG)
                .action(OrderAction.OPEN)
                .price(price)
                .size(size)
                .stopLoss(price * 0.95)
                .build();
    }

    private static OrderRequest close(String symbol, double price, String reason) {
        return OrderRequest.builder()
                .symbol(symbol)
                .action(OrderAction.CLOSE)
                .price(price)
                .reason(reason)
                .build();
    }

    @Test
    void placesPendingOrderWhenRiskAllows() {
        OrderResult result = executor.placeOrder(open("SOL", 100, 1));

        assertThat(result.success()).isTrue();
        Order order = executor.getOrder(result.orderId()).orElseThrow();
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(order.getStopLoss()).isEqualTo(95.0);
        assertThat(executor.pendingOrders()).hasSize(1);
    }

    @Test
    void rejectsInvalidRequests() {
        assertThat(executor.placeOrder(open(" ", 100, 1)).rejection()).isEqualTo(RiskRejection.INVALID_ORDER);
        assertThat(executor.placeOrder(open("SOL", 100, 0)).rejection()).isEqualTo(RiskRejection.INVALID_ORDER);
        assertThat(executor.placeOrder(null).rejection()).isEqualTo(RiskRejection.INVALID_ORDER);
    }

    @Test
    void rejectsWhileAnotherOrderIsPending() {
        executor.placeOrder(open("SOL", 100, 1));
        clock.advance(Duration.ofMinutes(5));

        OrderResult second = executor.placeOrder(open("SOL", 100, 0.5));

        assertThat(second.success()).isFalse();
        assertThat(second.rejection()).isEqualTo(RiskRejection.PENDING_ORDER);
    }

    @Test
    void enforcesMinimumOrderInterval() {
        OrderResult first = executor.placeOrder(open("SOL", 100, 1));
        executor.cancelOrder(first.orderId());
        clock.advance(Duration.ofSeconds(30));

        assertThat(executor.placeOrder(open("SOL", 100, 1)).rejection()).isEqualTo(RiskRejection.ORDER_INTERVAL);

        clock.advance(Duration.ofSeconds(30));
        assertThat(executor.placeOrder(open("SOL", 100, 1)).success()).isTrue();
    }

    @Test
    void riskRejectionCreatesNoOrder() {
        OrderResult result = executor.placeOrder(open("SOL", 100, 5));

        assertThat(result.rejection()).isEqualTo(RiskRejection.POSITION_SIZE);
        assertThat(executor.pendingOrders()).isEmpty();
        assertThat(metrics.rejectCounts()).containsEntry("position_size", 1L);
    }

    @Test
    void openFillCreatesPosition() {
        OrderResult placed = executor.placeOrder(open("SOL", 100, 1));

        OrderResult filled = executor.handleFill(placed.orderId(), 100, 1);

        assertThat(filled.success()).isTrue();
        assertThat(executor.getOrder(placed.orderId()).orElseThrow().getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(riskManager.getPosition("SOL")).isPresent();
        assertThat(riskManager.getPosition("SOL").get().getStopLoss()).isEqualTo(95.0);
        assertThat(metrics.tradesExecuted()).isEqualTo(1);
    }

    @Test
    void slippageIsAdvisoryOnly() {
        OrderResult placed = executor.placeOrder(open("SOL", 100, 0.9));

        OrderResult filled = executor.handleFill(placed.orderId(), 102, 0.9);

        assertThat(filled.success()).isTrue();
        assertThat(riskManager.getPosition("SOL").orElseThrow().getEntryPrice()).isEqualTo(102.0);
    }

    @Test
    void fillIsRecheckedAgainstRiskLimits() {
        OrderResult placed = executor.placeOrder(open("SOL", 100, 1));

        OrderResult filled = executor.handleFill(placed.orderId(), 100, 3);

        assertThat(filled.success()).isFalse();
        assertThat(filled.rejection()).isEqualTo(RiskRejection.POSITION_SIZE);
        assertThat(executor.getOrder(placed.orderId()).orElseThrow().getStatus()).isEqualTo(OrderStatus.FAILED);
        assertThat(riskManager.getPosition("SOL")).isEmpty();
    }

    @Test
    void fillOnUnknownOrTerminalOrderFailsFast() {
        assertThatThrownBy(() -> executor.handleFill("missing", 100, 1))
                .isInstanceOf(RiskPreconditionException.class);

        OrderResult placed = executor.placeOrder(open("SOL", 100, 1));
        executor.handleFill(placed.orderId(), 100, 1);
        assertThatThrownBy(() -> executor.handleFill(placed.orderId(), 100, 1))
                .isInstanceOf(RiskPreconditionException.class);
    }

    @Test
    void closeFillRecordsTrade() {
        OrderResult opened = executor.placeOrder(open("SOL", 100, 1));
        executor.handleFill(opened.orderId(), 100, 1);
        clock.advance(Duration.ofMinutes(2));

        OrderResult closing = executor.placeOrder(close("SOL", 110, "take_profit"));
        Order closeOrder = executor.getOrder(closing.orderId()).orElseThrow();
        assertThat(closeOrder.getSide()).isEqualTo(PositionSide.LONG);
        assertThat(closeOrder.getRequestedSize()).isEqualTo(1.0);

        executor.handleFill(closing.orderId(), 110, 1);

        ArgumentCaptor<ClosedTrade> trade = ArgumentCaptor.forClass(ClosedTrade.class);
        verify(recorder).record(trade.capture());
        assertThat(trade.getValue().getRealizedPnl()).isCloseTo(10.0, within(1e-9));
        assertThat(trade.getValue().getExitReason()).isEqualTo("take_profit");
        assertThat(riskManager.currentCapital()).isCloseTo(1010.0, within(1e-9));
    }

    @Test
    void closeWithoutPositionIsRejected() {
        OrderResult result = executor.placeOrder(close("SOL", 100, null));

        assertThat(result.rejection()).isEqualTo(RiskRejection.NO_POSITION);
        verify(recorder, never()).record(any());
    }

    @Test
    void cancelIsOnlyLegalWhilePending() {
        OrderResult placed = executor.placeOrder(open("SOL", 100, 1));

        assertThat(executor.cancelOrder(placed.orderId())).isTrue();
        assertThat(executor.getOrder(placed.orderId()).orElseThrow().getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(executor.cancelOrder(placed.orderId())).isFalse();
        assertThat(executor.cancelOrder("missing")).isFalse();
        assertThatThrownBy(() -> executor.handleFill(placed.orderId(), 100, 1))
                .isInstanceOf(RiskPreconditionException.class);
    }

    @Test
    void failedOrderReleasesSymbolThrottle() {
        OrderResult placed = executor.placeOrder(open("SOL", 100, 1));

        executor.markFailed(placed.orderId(), "transport: timeout");

        assertThat(executor.getOrder(placed.orderId()).orElseThrow().getStatus()).isEqualTo(OrderStatus.FAILED);
        assertThat(executor.placeOrder(open("SOL", 100, 1)).success()).isTrue();
    }

    @Test
    void failingRecorderDoesNotLeaveCloseOrderPending() {
        doThrow(new IllegalStateException("disk full")).when(recorder).record(any());
        OrderResult opened = executor.placeOrder(open("SOL", 100, 1));
        executor.handleFill(opened.orderId(), 100, 1);
        clock.advance(Duration.ofMinutes(2));
        OrderResult closing = executor.placeOrder(close("SOL", 110, "signal"));

        OrderResult filled = executor.handleFill(closing.orderId(), 110, 1);

        assertThat(filled.success()).isTrue();
        assertThat(executor.getOrder(closing.orderId()).orElseThrow().getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(riskManager.getPosition("SOL")).isEmpty();
        clock.advance(Duration.ofMinutes(10));
        assertThat(executor.placeOrder(open("SOL", 100, 1)).success()).isTrue();
    }

    @Test
    void symbolsAreMatchedExactly() {
        OrderResult upper = executor.placeOrder(open("SOL", 100, 1));
        executor.handleFill(upper.orderId(), 100, 1);

        OrderResult lower = executor.placeOrder(open("sol", 10, 1));

        assertThat(lower.success()).isTrue();
        assertThat(riskManager.canOpen("sol", 10, 1).allowed()).isTrue();
        assertThat(riskManager.canOpen("SOL", 10, 1).rejection()).isEqualTo(RiskRejection.DUPLICATE_POSITION);
    }
}
