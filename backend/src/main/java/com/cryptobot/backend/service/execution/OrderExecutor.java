package com.cryptobot.backend.service.execution;

import com.cryptobot.backend.exception.RiskPreconditionException;
import com.cryptobot.backend.model.ClosedTrade;
import com.cryptobot.backend.model.Order;
import com.cryptobot.backend.model.OrderAction;
import com.cryptobot.backend.model.OrderStatus;
import com.cryptobot.backend.model.Position;
import com.cryptobot.backend.model.PositionSide;
import com.cryptobot.backend.service.MetricsService;
import com.cryptobot.backend.service.TradeRecorder;
import com.cryptobot.backend.service.risk.RiskCheckResult;
import com.cryptobot.backend.service.risk.RiskManager;
import com.cryptobot.backend.service.risk.RiskRejection;
import com.cryptobot.backend.service.risk.SymbolIntervalGuard;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Order lifecycle on top of the live {@link RiskManager}.
 * <p>
 * Orders are admitted against the risk gate, settled on fill and forwarded to the trade recorder
 * once a position closes. Not thread-safe; the trade processor's consumer is the only caller.
 */
@Slf4j
public class OrderExecutor {

    private final RiskManager riskManager;
    private final OrderStateMachine stateMachine;
    private final TradeRecorder tradeRecorder;
    private final MetricsService metricsService;
    private final Clock clock;
    private final double maxSlippage;
    private final Duration minOrderInterval;
    private final double feeRate;

    private final Map<String, Order> orders = new ConcurrentHashMap<>();
    private final SymbolIntervalGuard orderIntervals = new SymbolIntervalGuard();

    public OrderExecutor(RiskManager riskManager,
                         OrderStateMachine stateMachine,
                         TradeRecorder tradeRecorder,
                         MetricsService metricsService,
                         Clock clock,
                         double maxSlippage,
                         Duration minOrderInterval,
                         double feeRate) {
        this.riskManager = riskManager;
        this.stateMachine = stateMachine;
        this.tradeRecorder = tradeRecorder;
        this.metricsService = metricsService;
        this.clock = clock;
        this.maxSlippage = maxSlippage;
        this.minOrderInterval = minOrderInterval;
        this.feeRate = feeRate;
    }

    public OrderResult placeOrder(OrderRequest request) {
        String invalid = validate(request);
        if (invalid != null) {
            return reject(null, RiskRejection.INVALID_ORDER, invalid);
        }
        String symbol = request.symbol();
        Instant now = clock.instant();

        Optional<Order> pending = pendingFor(symbol);
        if (pending.isPresent()) {
            return reject(null, RiskRejection.PENDING_ORDER,
                    "Order " + pending.get().getId() + " still pending for " + symbol);
        }
        if (orderIntervals.isInCooldown(symbol, now, minOrderInterval)) {
            return reject(null, RiskRejection.ORDER_INTERVAL,
                    "Last order for " + symbol + " was " + orderIntervals.elapsedSince(symbol, now).toSeconds()
                            + "s ago, need " + minOrderInterval.toSeconds() + "s");
        }

        PositionSide side = request.side();
        double size = request.size();
        RiskCheckResult check;
        if (request.action() == OrderAction.OPEN) {
            check = riskManager.canOpen(symbol, request.price(), size, request.price() * size * feeRate);
        } else {
            check = riskManager.canClose(symbol);
            if (check.allowed()) {
                Position position = riskManager.getPosition(symbol).orElseThrow();
                side = position.getSide();
                size = size > 0 ? size : position.getQuantity();
            }
        }
        if (!check.allowed()) {
            return reject(null, check.rejection(), check.detail());
        }

        Order order = Order.builder()
                .id(UUID.randomUUID().toString())
                .symbol(symbol)
                .side(side)
                .action(request.action())
                .requestedPrice(request.price())
                .requestedSize(size)
                .status(OrderStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .stopLoss(request.stopLoss())
                .takeProfit(request.takeProfit())
                .reason(request.reason())
                .build();
        orders.put(order.getId(), order);
        orderIntervals.record(symbol, now);
        metricsService.recordOrderPlaced();
        log.info("Placed {} {} order {} for {}: {} @ {}", request.action(), side, order.getId(), symbol, size, request.price());
        return OrderResult.accepted(order.getId());
    }

    public OrderResult handleFill(String orderId, double filledPrice, double filledQuantity) {
        Order order = orders.get(orderId);
        if (order == null) {
            throw new RiskPreconditionException("Unknown order id " + orderId);
        }
        if (!order.isPending()) {
            throw new RiskPreconditionException("Order " + orderId + " is already " + order.getStatus());
        }
        if (filledPrice <= 0 || filledQuantity <= 0) {
            throw new RiskPreconditionException("Invalid fill for " + orderId + ": " + filledQuantity + " @ " + filledPrice);
        }

        double slippage = Math.abs(filledPrice - order.getRequestedPrice()) / order.getRequestedPrice();
        if (slippage > maxSlippage) {
            log.warn("⚠️ High slippage on order {} [{}]: requested {} filled {} ({}%)",
                    orderId, order.getSymbol(), order.getRequestedPrice(), filledPrice, String.format("%.3f", slippage * 100));
        }

        Instant now = clock.instant();
        String symbol = order.getSymbol();
        double fee = filledPrice * filledQuantity * feeRate;
        ClosedTrade closed = null;

        if (order.getAction() == OrderAction.OPEN) {
            RiskCheckResult check = riskManager.canOpen(symbol, filledPrice, filledQuantity, fee);
            if (!check.allowed()) {
                stateMachine.transition(order, OrderStatus.FAILED, check.rejection().code());
                return reject(orderId, check.rejection(), check.detail());
            }
            riskManager.open(symbol, filledPrice, filledQuantity, order.getSide(), now,
                    order.getStopLoss(), order.getTakeProfit(), fee);
        } else {
            Position position = riskManager.getPosition(symbol)
                    .orElseThrow(() -> new RiskPreconditionException("No open position to close for " + symbol));
            if (Math.abs(position.getQuantity() - filledQuantity) > 1e-9) {
                log.warn("Close fill quantity {} differs from position quantity {} for {}; closing whole position",
                        filledQuantity, position.getQuantity(), symbol);
            }
            String reason = order.getReason() != null ? order.getReason() : "signal";
            closed = riskManager.close(symbol, filledPrice, now, fee, reason);
        }

        order.setFilledPrice(filledPrice);
        order.setFilledQuantity(filledQuantity);
        stateMachine.transition(order, OrderStatus.FILLED, "filled");
        metricsService.recordTradeExecuted();
        if (closed != null) {
            record(closed);
        }
        return OrderResult.accepted(orderId);
    }

    private void record(ClosedTrade trade) {
        try {
            tradeRecorder.record(trade);
        } catch (RuntimeException e) {
            // ledger and order are already settled
            log.error("Failed to record closed trade on {}", trade.getSymbol(), e);
        }
    }

    /**
     * @return false when the order is unknown or no longer pending
     */
    public boolean cancelOrder(String orderId) {
        Order order = orders.get(orderId);
        if (order == null || !order.isPending()) {
            log.warn("Cannot cancel order {}: {}", orderId, order == null ? "unknown" : order.getStatus());
            return false;
        }
        return stateMachine.transition(order, OrderStatus.CANCELLED, "cancelled");
    }

    /**
     * Marks a pending order as failed, e.g. when the transport never got it to market. The symbol's
     * order throttle is released since nothing reached the market.
     */
    public void markFailed(String orderId, String reason) {
        Order order = orders.get(orderId);
        if (order == null) {
            log.warn("markFailed for unknown order {}", orderId);
            return;
        }
        if (stateMachine.transition(order, OrderStatus.FAILED, reason)) {
            orderIntervals.clear(order.getSymbol());
        }
    }

    public Optional<Order> getOrder(String orderId) {
        return Optional.ofNullable(orders.get(orderId)).map(this::copy);
    }

    public List<Order> pendingOrders() {
        return orders.values().stream()
                .filter(Order::isPending)
                .sorted(Comparator.comparing(Order::getCreatedAt))
                .map(this::copy)
                .toList();
    }

    private Optional<Order> pendingFor(String symbol) {
        return orders.values().stream()
                .filter(Order::isPending)
                .filter(order -> order.getSymbol().equals(symbol))
                .findFirst();
    }

    private String validate(OrderRequest request) {
        if (request == null) {
            return "Order request is required";
        }
        if (request.symbol() == null || request.symbol().isBlank()) {
            return "Symbol is required";
        }
        if (request.action() == null) {
            return "Order action is required";
        }
        if (request.price() <= 0) {
            return "Price must be positive: " + request.price();
        }
        if (request.action() == OrderAction.OPEN) {
            if (request.side() == null) {
                return "Side is required to open a position";
            }
            if (request.size() <= 0) {
                return "Size must be positive: " + request.size();
            }
        }
        return null;
    }

    private OrderResult reject(String orderId, RiskRejection rejection, String detail) {
        metricsService.recordReject(rejection.code());
        log.warn("Order rejected [{}]: {}", rejection.code(), detail);
        return OrderResult.rejected(orderId, rejection, detail);
    }

    private Order copy(Order order) {
        return order.toBuilder().build();
    }
}
