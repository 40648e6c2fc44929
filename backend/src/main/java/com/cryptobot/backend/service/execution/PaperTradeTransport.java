package com.cryptobot.backend.service.execution;

import com.cryptobot.backend.model.OrderAction;
import com.cryptobot.backend.model.PositionSide;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;

/**
 * Fills every order immediately at the quoted price.
 */
@Slf4j
@RequiredArgsConstructor
public class PaperTradeTransport implements TradeTransport {

    private final Clock clock;

    @Override
    public Quote getQuote(String clientOrderId, String symbol, PositionSide side, OrderAction action, double size, double price) {
        return new Quote(clientOrderId, symbol, side, action, size, price, clock.instant());
    }

    @Override
    public OrderHandle submit(Quote quote) {
        log.info("📝 PAPER {} {} {} x {} @ {}", quote.action(), quote.side(), quote.symbol(), quote.size(), quote.price());
        FillNotification fill = new FillNotification(quote.clientOrderId(), quote.price(), quote.size());
        return new OrderHandle(quote.clientOrderId(), CompletableFuture.completedFuture(fill));
    }
}
