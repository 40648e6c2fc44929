package com.cryptobot.backend.model;

import java.time.Instant;

/**
 * One replay step: the price bar plus the signal computed for it.
 */
public record BacktestBar(Candle candle, MarketSignal signal) {

    public Instant timestamp() {
        return candle.getTimestamp();
    }

    public double close() {
        return candle.getClose();
    }
}
