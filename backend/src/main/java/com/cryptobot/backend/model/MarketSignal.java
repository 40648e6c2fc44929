package com.cryptobot.backend.model;

import lombok.Builder;

import java.time.Instant;

/**
 * Indicator snapshot for one symbol at one time step. Produced by the analysis layer and
 * consumed as-is.
 */
@Builder(toBuilder = true)
public record MarketSignal(
        String symbol,
        Instant timestamp,
        double price,
        double rsi,
        double macd,
        double macdSignal,
        Trend trend,
        double support,
        double resistance,
        double volatility,
        Double liquidity,
        // optional, supplied by sources that carry them
        Double confidence,
        Double atr
) {}
