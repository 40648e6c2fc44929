package com.cryptobot.backend.model;

import lombok.Builder;
import lombok.Value;

/**
 * Session-scoped risk configuration. Fractions are relative to current capital.
 */
@Value
@Builder(toBuilder = true)
public class RiskLimits {
    @Builder.Default double maxPositionFraction = 0.1;
    @Builder.Default double maxTotalExposure = 0.5;
    @Builder.Default double maxDrawdown = 0.15;
    @Builder.Default double riskPerTrade = 0.02;
    @Builder.Default int maxDailyTrades = 10;
    @Builder.Default double maxDailyLoss = 0.05;
    @Builder.Default double correlationThreshold = 0.7;
    @Builder.Default double minVolatility = 0.01;
    @Builder.Default double maxVolatility = 0.05;
    @Builder.Default double minLiquidity = 1_000_000.0;
    @Builder.Default long minTradeIntervalSeconds = 300;
    @Builder.Default double minWinRate = 0.4;
    @Builder.Default int minTradesForWinRate = 10;
    @Builder.Default int atrPeriod = 14;
    @Builder.Default double stopLossAtrMultiplier = 2.0;
    @Builder.Default double takeProfitAtrMultiplier = 3.0;
    @Builder.Default int correlationLookback = 30;
    @Builder.Default int historyLimit = 100;
}
