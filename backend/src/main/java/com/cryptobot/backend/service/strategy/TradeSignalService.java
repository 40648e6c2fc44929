package com.cryptobot.backend.service.strategy;

import com.cryptobot.backend.model.MarketSignal;
import com.cryptobot.backend.service.processor.TradeOutcome;
import com.cryptobot.backend.service.processor.TradeProcessor;
import com.cryptobot.backend.service.processor.TradeRequest;
import lombok.RequiredArgsConstructor;

import java.util.concurrent.CompletableFuture;

/**
 * Entry point for the live signal source. Safe to call from any thread.
 */
@RequiredArgsConstructor
public class TradeSignalService {

    private final TradeProcessor tradeProcessor;

    public CompletableFuture<TradeOutcome> onSignal(MarketSignal signal) {
        if (signal == null || signal.symbol() == null || signal.price() <= 0) {
            throw new IllegalArgumentException("Signal needs a symbol and a positive price");
        }
        TradeRequest request = TradeRequest.signal(signal);
        tradeProcessor.enqueue(request);
        return request.getOutcome();
    }
}
