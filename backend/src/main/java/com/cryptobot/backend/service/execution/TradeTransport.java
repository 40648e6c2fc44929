package com.cryptobot.backend.service.execution;

import com.cryptobot.backend.model.OrderAction;
import com.cryptobot.backend.model.PositionSide;

/**
 * Exchange-facing port. Implementations may block inside {@link #submit} but must complete the
 * returned fill future from their own threads.
 */
public interface TradeTransport {

    Quote getQuote(String clientOrderId, String symbol, PositionSide side, OrderAction action, double size, double price);

    OrderHandle submit(Quote quote);
}
