package com.cryptobot.backend.service.processor;

import com.cryptobot.backend.model.MarketSignal;
import com.cryptobot.backend.model.OrderAction;
import com.cryptobot.backend.model.PositionSide;
import com.cryptobot.backend.service.risk.RiskRejection;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

@Getter
public class TradeRequest {

    private final String id;
    private final TradeRequestType type;
    private final String symbol;
    private final PositionSide side;
    private final OrderAction action;
    private final double price;
    private final double size;
    private final Double stopLoss;
    private final Double takeProfit;
    private final String reason;
    private final MarketSignal signal;
    private final CompletableFuture<TradeOutcome> outcome = new CompletableFuture<>();

    // Set on the consumer thread only, apart from enqueuedAt which the processor stamps on enqueue
    private volatile Instant enqueuedAt;
    private volatile String orderId;
    private volatile int attempts;
    private volatile RiskRejection rejection;
    private volatile String rejectionDetail;

    @Builder
    private TradeRequest(TradeRequestType type, String symbol, PositionSide side, OrderAction action,
                         double price, double size, Double stopLoss, Double takeProfit, String reason,
                         MarketSignal signal, String orderId) {
        this.id = UUID.randomUUID().toString();
        this.type = type;
        this.symbol = symbol;
        this.side = side;
        this.action = action;
        this.price = price;
        this.size = size;
        this.stopLoss = stopLoss;
        this.takeProfit = takeProfit;
        this.reason = reason;
        this.signal = signal;
        this.orderId = orderId;
    }

    public static TradeRequest open(String symbol, PositionSide side, double price, double size,
                                    Double stopLoss, Double takeProfit) {
        return TradeRequest.builder()
                .type(TradeRequestType.ORDER)
                .action(OrderAction.OPEN)
                .symbol(symbol)
                .side(side)
                .price(price)
                .size(size)
                .stopLoss(stopLoss)
                .takeProfit(takeProfit)
                .build();
    }

    public static TradeRequest close(String symbol, double price, String reason) {
        return TradeRequest.builder()
                .type(TradeRequestType.ORDER)
                .action(OrderAction.CLOSE)
                .symbol(symbol)
                .price(price)
                .reason(reason)
                .build();
    }

    public static TradeRequest fill(String orderId, String symbol, double price, double quantity) {
        return TradeRequest.builder()
                .type(TradeRequestType.FILL)
                .orderId(orderId)
                .symbol(symbol)
                .price(price)
                .size(quantity)
                .build();
    }

    public static TradeRequest fillFailed(String orderId, String symbol, String reason) {
        return TradeRequest.builder()
                .type(TradeRequestType.FILL_FAILED)
                .orderId(orderId)
                .symbol(symbol)
                .reason(reason)
                .build();
    }

    public static TradeRequest cancel(String orderId) {
        return TradeRequest.builder()
                .type(TradeRequestType.CANCEL)
                .orderId(orderId)
                .build();
    }

    public static TradeRequest signal(MarketSignal signal) {
        return TradeRequest.builder()
                .type(TradeRequestType.SIGNAL)
                .symbol(signal.symbol())
                .price(signal.price())
                .signal(signal)
                .build();
    }

    public void reject(RiskRejection rejection, String detail) {
        this.rejection = rejection;
        this.rejectionDetail = detail;
    }

    public boolean isRejected() {
        return rejection != null;
    }

    public void assignOrderId(String orderId) {
        this.orderId = orderId;
    }

    void markEnqueued(Instant at) {
        if (enqueuedAt == null) {
            enqueuedAt = at;
        }
    }

    int beginAttempt() {
        // reset per-attempt refusal so a retried request is judged afresh
        this.rejection = null;
        this.rejectionDetail = null;
        return ++attempts;
    }

    String describe() {
        return type + " " + (symbol != null ? symbol : "-") + " id=" + id
                + (orderId != null ? " order=" + orderId : "");
    }
}
