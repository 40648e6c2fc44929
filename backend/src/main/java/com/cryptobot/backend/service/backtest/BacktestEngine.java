package com.cryptobot.backend.service.backtest;

import com.cryptobot.backend.config.BacktestProperties;
import com.cryptobot.backend.config.RiskProperties;
import com.cryptobot.backend.exception.BacktestDataException;
import com.cryptobot.backend.model.BacktestBar;
import com.cryptobot.backend.model.BacktestResult;
import com.cryptobot.backend.model.Candle;
import com.cryptobot.backend.model.ClosedTrade;
import com.cryptobot.backend.model.MarketSignal;
import com.cryptobot.backend.model.Position;
import com.cryptobot.backend.model.PositionSide;
import com.cryptobot.backend.model.RiskLimits;
import com.cryptobot.backend.service.indicator.AtrService;
import com.cryptobot.backend.service.risk.CorrelationService;
import com.cryptobot.backend.service.risk.DefaultRiskManager;
import com.cryptobot.backend.service.risk.RiskManager;
import com.cryptobot.backend.service.strategy.SignalRules;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Replays the live entry, exit and risk rules over a historical series.
 * <p>
 * Every run gets its own {@link DefaultRiskManager} on a {@link ReplayClock}, so runs are deterministic
 * and independent of each other and of the live engine.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BacktestEngine {

    public static final String BACKTEST_END = "backtest_end";

    private final RiskProperties riskProperties;
    private final BacktestProperties backtestProperties;
    private final SignalRules signalRules;
    private final AtrService atrService;
    private final CorrelationService correlationService;
    private final PerformanceCalculator performanceCalculator;

    public BacktestResult run(String symbol, List<BacktestBar> bars) {
        validate(symbol, bars);
        return run(symbol, bars, bars.get(0).timestamp(), bars.get(bars.size() - 1).timestamp());
    }

    public BacktestResult run(String symbol, List<BacktestBar> bars, Instant start, Instant end) {
        validate(symbol, bars);
        if (start == null || end == null || start.isAfter(end)) {
            throw new BacktestDataException("Invalid backtest window " + start + " .. " + end);
        }
        int first = -1;
        int last = -1;
        for (int i = 0; i < bars.size(); i++) {
            Instant ts = bars.get(i).timestamp();
            if (!ts.isBefore(start) && !ts.isAfter(end)) {
                if (first < 0) {
                    first = i;
                }
                last = i;
            }
        }
        if (first < 0) {
            throw new BacktestDataException("No price data available between " + start + " and " + end);
        }

        double initialCapital = backtestProperties.getInitialCapital();
        double feeRate = backtestProperties.getFeeRate();
        RiskLimits limits = riskProperties.toLimits();
        ReplayClock clock = new ReplayClock(bars.get(first).timestamp());
        RiskManager riskManager = new DefaultRiskManager(limits, initialCapital, clock, correlationService, atrService);

        List<Double> highs = new ArrayList<>();
        List<Double> lows = new ArrayList<>();
        List<Double> closes = new ArrayList<>();
        for (int i = 0; i < first; i++) {
            addCandle(bars.get(i).candle(), highs, lows, closes);
        }

        List<Double> equityCurve = new ArrayList<>();
        equityCurve.add(initialCapital);

        for (int i = first; i <= last; i++) {
            BacktestBar bar = bars.get(i);
            Instant ts = bar.timestamp();
            double price = bar.close();
            MarketSignal signal = bar.signal();
            clock.set(ts);
            addCandle(bar.candle(), highs, lows, closes);
            riskManager.updateMarketData(symbol, price, signal.volatility(), signal.liquidity());

            Optional<Position> open = riskManager.getPosition(symbol);
            if (open.isPresent()) {
                Position position = open.get();
                Optional<String> exit = signalRules.exitSignal(position, signal);
                if (exit.isEmpty() && signalRules.enforceStops()) {
                    exit = riskManager.evaluateProtection(symbol, price);
                }
                if (exit.isPresent()) {
                    riskManager.close(symbol, price, ts, price * position.getQuantity() * feeRate, exit.get());
                }
            } else {
                signalRules.entrySignal(signal).ifPresent(side ->
                        tryEnter(riskManager, symbol, side, price, ts, feeRate, highs, lows, closes, limits.getAtrPeriod()));
            }
            equityCurve.add(riskManager.currentCapital());
        }

        BacktestBar finalBar = bars.get(last);
        Optional<Position> remaining = riskManager.getPosition(symbol);
        if (remaining.isPresent()) {
            double price = finalBar.close();
            riskManager.close(symbol, price, finalBar.timestamp(), price * remaining.get().getQuantity() * feeRate, BACKTEST_END);
            equityCurve.add(riskManager.currentCapital());
        }

        BacktestResult result = buildResult(symbol, bars.get(first).timestamp(), finalBar.timestamp(),
                initialCapital, riskManager, equityCurve);
        log.info("Backtest {} [{} .. {}]: {} trades, final capital {}, win rate {}",
                symbol, result.getStartTime(), result.getEndTime(), result.getTotalTrades(),
                result.getFinalCapital(), result.getWinRate());
        return result;
    }

    private void tryEnter(RiskManager riskManager, String symbol, PositionSide side, double price, Instant ts,
                          double feeRate, List<Double> highs, List<Double> lows, List<Double> closes, int atrPeriod) {
        OptionalDouble atr = riskManager.computeAtr(highs, lows, closes, atrPeriod);
        double stop = signalRules.initialStop(price, atr, side, riskManager);
        Double target = signalRules.initialTarget(price, atr, side, riskManager);
        double size = signalRules.entrySize(price, stop, feeRate, riskManager);
        if (size <= 0) {
            return;
        }
        double entryFee = price * size * feeRate;
        if (!riskManager.canOpen(symbol, price, size, entryFee).allowed()) {
            return;
        }
        riskManager.open(symbol, price, size, side, ts, stop, target, entryFee);
    }

    private BacktestResult buildResult(String symbol, Instant start, Instant end, double initialCapital,
                                       RiskManager riskManager, List<Double> equityCurve) {
        List<ClosedTrade> trades = riskManager.closedTrades();
        List<Double> returns = performanceCalculator.periodReturns(equityCurve);
        double riskFree = backtestProperties.getAnnualRiskFreeRate();
        int periodsPerYear = backtestProperties.getPeriodsPerYear();
        long wins = trades.stream().filter(ClosedTrade::isWin).count();

        return BacktestResult.builder()
                .symbol(symbol)
                .startTime(start)
                .endTime(end)
                .initialCapital(initialCapital)
                .finalCapital(riskManager.currentCapital())
                .totalTrades(trades.size())
                .winningTrades((int) wins)
                .losingTrades(trades.size() - (int) wins)
                .winRate(performanceCalculator.winRate(trades))
                .totalPnl(riskManager.currentCapital() - initialCapital)
                .realizedPnl(trades.stream().mapToDouble(ClosedTrade::getRealizedPnl).sum())
                .totalFees(trades.stream().mapToDouble(ClosedTrade::getFees).sum())
                .profitFactor(performanceCalculator.profitFactor(trades))
                .averageTradeHours(performanceCalculator.averageTradeHours(trades))
                .sharpeRatio(performanceCalculator.sharpeRatio(returns, riskFree, periodsPerYear))
                .sortinoRatio(performanceCalculator.sortinoRatio(returns, riskFree, periodsPerYear))
                .maxDrawdown(performanceCalculator.maxDrawdown(returns))
                .trades(trades)
                .equityCurve(equityCurve)
                .build();
    }

    private void validate(String symbol, List<BacktestBar> bars) {
        if (symbol == null || symbol.isBlank()) {
            throw new BacktestDataException("Symbol is required");
        }
        if (bars == null || bars.isEmpty()) {
            throw new BacktestDataException("No price data available");
        }
        Instant previous = null;
        for (int i = 0; i < bars.size(); i++) {
            BacktestBar bar = bars.get(i);
            if (bar == null || bar.candle() == null || bar.signal() == null || bar.timestamp() == null) {
                throw new BacktestDataException("Incomplete bar at index " + i);
            }
            if (bar.close() <= 0 || Double.isNaN(bar.close())) {
                throw new BacktestDataException("Non-positive close at index " + i + ": " + bar.close());
            }
            if (previous != null && bar.timestamp().isBefore(previous)) {
                throw new BacktestDataException("Bars out of order at index " + i);
            }
            previous = bar.timestamp();
        }
    }

    private void addCandle(Candle candle, List<Double> highs, List<Double> lows, List<Double> closes) {
        highs.add(candle.getHigh());
        lows.add(candle.getLow());
        closes.add(candle.getClose());
    }
}
