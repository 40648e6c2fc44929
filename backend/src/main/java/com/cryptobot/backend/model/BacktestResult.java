package com.cryptobot.backend.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.OptionalDouble;

@Value
@Builder
public class BacktestResult {
    String symbol;
    Instant startTime;
    Instant endTime;
    double initialCapital;
    double finalCapital;
    int totalTrades;
    int winningTrades;
    int losingTrades;
    double winRate;
    double totalPnl;
    double realizedPnl;
    double totalFees;
    OptionalDouble profitFactor;
    OptionalDouble averageTradeHours;
    OptionalDouble sharpeRatio;
    OptionalDouble sortinoRatio;
    double maxDrawdown;
    @Singular List<ClosedTrade> trades;
    @Singular("equityPoint") List<Double> equityCurve;
}
