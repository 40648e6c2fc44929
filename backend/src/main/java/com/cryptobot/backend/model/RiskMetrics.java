package com.cryptobot.backend.model;

import java.util.Map;
import java.util.OptionalDouble;

public record RiskMetrics(
        Map<String, Double> exposureBySymbol,
        double totalExposure,
        double currentCapital,
        double peakCapital,
        double drawdown,
        double dailyPnl,
        int dailyTrades,
        double winRate,
        OptionalDouble profitFactor,
        OptionalDouble avgWinLossRatio,
        OptionalDouble sharpeRatio
) {}
