package com.cryptobot.backend.service.backtest;

import com.cryptobot.backend.model.ClosedTrade;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Risk-adjusted statistics over an equity curve and its closed trades.
 */
@Component
public class PerformanceCalculator {

    public List<Double> periodReturns(List<Double> equityCurve) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < equityCurve.size(); i++) {
            double previous = equityCurve.get(i - 1);
            if (previous != 0) {
                returns.add(equityCurve.get(i) / previous - 1.0);
            }
        }
        return returns;
    }

    /**
     * √periodsPerYear × mean excess return / sample std of returns. Empty with fewer than two returns
     * or no dispersion.
     */
    public OptionalDouble sharpeRatio(List<Double> returns, double annualRiskFreeRate, int periodsPerYear) {
        if (returns.size() < 2) {
            return OptionalDouble.empty();
        }
        double std = sampleStd(returns);
        if (std == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Math.sqrt(periodsPerYear) * meanExcess(returns, annualRiskFreeRate, periodsPerYear) / std);
    }

    /**
     * Like {@link #sharpeRatio} but divides by the dispersion of the negative returns only.
     */
    public OptionalDouble sortinoRatio(List<Double> returns, double annualRiskFreeRate, int periodsPerYear) {
        List<Double> downside = returns.stream().filter(r -> r < 0).toList();
        if (downside.size() < 2) {
            return OptionalDouble.empty();
        }
        double downsideStd = sampleStd(downside);
        if (downsideStd == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Math.sqrt(periodsPerYear) * meanExcess(returns, annualRiskFreeRate, periodsPerYear) / downsideStd);
    }

    /**
     * Deepest peak-to-trough fall of the compounded returns, as a non-positive fraction.
     */
    public double maxDrawdown(List<Double> returns) {
        double cumulative = 1.0;
        double runningMax = 1.0;
        double worst = 0.0;
        for (double r : returns) {
            cumulative *= 1.0 + r;
            runningMax = Math.max(runningMax, cumulative);
            worst = Math.min(worst, (cumulative - runningMax) / runningMax);
        }
        return worst;
    }

    public double winRate(List<ClosedTrade> trades) {
        if (trades.isEmpty()) {
            return 0.0;
        }
        return (double) trades.stream().filter(ClosedTrade::isWin).count() / trades.size();
    }

    public OptionalDouble profitFactor(List<ClosedTrade> trades) {
        double grossWin = trades.stream().filter(t -> t.getRealizedPnl() > 0).mapToDouble(ClosedTrade::getRealizedPnl).sum();
        double grossLoss = trades.stream().filter(t -> t.getRealizedPnl() < 0).mapToDouble(t -> -t.getRealizedPnl()).sum();
        return grossLoss == 0 ? OptionalDouble.empty() : OptionalDouble.of(grossWin / grossLoss);
    }

    public OptionalDouble averageTradeHours(List<ClosedTrade> trades) {
        return trades.stream()
                .mapToDouble(t -> t.holdingTime().toSeconds() / 3600.0)
                .average();
    }

    private double meanExcess(List<Double> returns, double annualRiskFreeRate, int periodsPerYear) {
        double periodRiskFree = annualRiskFreeRate / periodsPerYear;
        return returns.stream().mapToDouble(r -> r - periodRiskFree).average().orElse(0.0);
    }

    private double sampleStd(List<Double> values) {
        double mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double sumSq = values.stream().mapToDouble(v -> Math.pow(v - mean, 2)).sum();
        return Math.sqrt(sumSq / (values.size() - 1));
    }
}
