package com.cryptobot.backend.service.execution;

import com.cryptobot.backend.exception.ExecutionFailureException;
import com.cryptobot.backend.model.Order;
import com.cryptobot.backend.service.processor.TradeHandler;
import com.cryptobot.backend.service.processor.TradeRequest;
import com.cryptobot.backend.service.risk.RiskRejection;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletionException;
import java.util.function.Consumer;

/**
 * Drives the {@link OrderExecutor} from the trade processor and sends admitted orders to the transport.
 * Fill callbacks only enqueue; settlement happens when the FILL request reaches the consumer.
 */
@Slf4j
@RequiredArgsConstructor
public class OrderExecutionHandler implements TradeHandler {

    private final OrderExecutor orderExecutor;
    private final TradeTransport transport;
    private final Retry transportRetry;
    private final Consumer<TradeRequest> fillSink;

    @Override
    public void handle(TradeRequest request) {
        switch (request.getType()) {
            case ORDER -> placeAndSubmit(request);
            case FILL -> settle(request);
            case FILL_FAILED -> orderExecutor.markFailed(request.getOrderId(), request.getReason());
            case CANCEL -> {
                if (!orderExecutor.cancelOrder(request.getOrderId())) {
                    request.reject(RiskRejection.INVALID_ORDER, "Order " + request.getOrderId() + " is not pending");
                }
            }
            default -> {
                // not an order event
            }
        }
    }

    private void placeAndSubmit(TradeRequest request) {
        OrderResult placed = orderExecutor.placeOrder(OrderRequest.builder()
                .symbol(request.getSymbol())
                .side(request.getSide())
                .action(request.getAction())
                .price(request.getPrice())
                .size(request.getSize())
                .stopLoss(request.getStopLoss())
                .takeProfit(request.getTakeProfit())
                .reason(request.getReason())
                .build());
        if (!placed.success()) {
            request.reject(placed.rejection(), placed.message());
            return;
        }
        request.assignOrderId(placed.orderId());
        Order order = orderExecutor.getOrder(placed.orderId()).orElseThrow();

        OrderHandle handle;
        try {
            handle = Retry.decorateSupplier(transportRetry, () -> transport.submit(transport.getQuote(
                    order.getId(), order.getSymbol(), order.getSide(), order.getAction(),
                    order.getRequestedSize(), order.getRequestedPrice()))).get();
        } catch (RuntimeException e) {
            orderExecutor.markFailed(order.getId(), "transport: " + e.getMessage());
            throw new ExecutionFailureException("Transport submit failed for " + order.getSymbol(), e);
        }

        handle.fill().whenComplete((fill, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
                log.error("Fill failed for order {} [{}]: {}", order.getId(), order.getSymbol(), cause.getMessage());
                fillSink.accept(TradeRequest.fillFailed(order.getId(), order.getSymbol(), cause.getMessage()));
            } else {
                fillSink.accept(TradeRequest.fill(order.getId(), order.getSymbol(), fill.price(), fill.quantity()));
            }
        });
    }

    private void settle(TradeRequest request) {
        OrderResult result = orderExecutor.handleFill(request.getOrderId(), request.getPrice(), request.getSize());
        if (!result.success()) {
            request.reject(result.rejection(), result.message());
        }
    }
}
