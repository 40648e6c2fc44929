package com.cryptobot.backend.service.processor;

/**
 * A processing step run by the trade processor's consumer thread. Throwing fails the attempt;
 * refusals are reported through {@link TradeRequest#reject}.
 */
@FunctionalInterface
public interface TradeHandler {

    void handle(TradeRequest request) throws Exception;
}
