package com.cryptobot.backend.service.risk;

import com.cryptobot.backend.exception.RiskPreconditionException;
import com.cryptobot.backend.model.CapitalState;
import com.cryptobot.backend.model.ClosedTrade;
import com.cryptobot.backend.model.Position;
import com.cryptobot.backend.model.PositionSide;
import com.cryptobot.backend.model.RiskLimits;
import com.cryptobot.backend.model.RiskMetrics;
import com.cryptobot.backend.service.indicator.AtrService;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * The single capital/position ledger. The live engine owns one instance and mutates it only from the
 * trade processor's consumer thread; backtests construct their own.
 */
@Slf4j
public class DefaultRiskManager implements RiskManager {

    static final int MIN_TRADES_FOR_SHARPE = 30;
    private static final double TRADING_DAYS = 252.0;
    // Tolerance so a position sized exactly at a limit is not rejected by rounding
    private static final double EPSILON = 1e-9;

    private final RiskLimits limits;
    private final Clock clock;
    private final CorrelationService correlationService;
    private final AtrService atrService;

    private final CapitalState capital;
    private final Map<String, Position> positions = new LinkedHashMap<>();
    private final List<ClosedTrade> closedTrades = new ArrayList<>();
    private final SymbolIntervalGuard tradeIntervals = new SymbolIntervalGuard();

    private final Map<String, Deque<Double>> priceHistory = new HashMap<>();
    private final Map<String, Deque<Double>> volatilityHistory = new HashMap<>();
    private final Map<String, Deque<Double>> liquidityHistory = new HashMap<>();

    private LocalDate tradingDay;
    private int dailyTrades;
    private double dailyPnl;

    public DefaultRiskManager(RiskLimits limits,
                              double initialCapital,
                              Clock clock,
                              CorrelationService correlationService,
                              AtrService atrService) {
        this.limits = limits;
        this.clock = clock;
        this.correlationService = correlationService;
        this.atrService = atrService;
        this.capital = new CapitalState(initialCapital);
        this.tradingDay = today();
    }

    public DefaultRiskManager(RiskLimits limits, double initialCapital, Clock clock) {
        this(limits, initialCapital, clock, new CorrelationService(), new AtrService());
    }

    @Override
    public RiskCheckResult canOpen(String symbol, double price, double size, double entryFee) {
        if (symbol == null || symbol.isBlank() || !(price > 0) || !(size > 0) || entryFee < 0) {
            return reject(RiskRejection.INVALID_ORDER, "Price and size must be positive for " + symbol);
        }

        int tradesToday = effectiveDailyTrades();
        if (tradesToday >= limits.getMaxDailyTrades()) {
            return reject(RiskRejection.DAILY_TRADE_LIMIT,
                    "Daily trade limit reached: " + tradesToday + " >= " + limits.getMaxDailyTrades());
        }

        double current = capital.current();
        double pnlToday = effectiveDailyPnl();
        if (pnlToday < -limits.getMaxDailyLoss() * current) {
            return reject(RiskRejection.DAILY_LOSS_LIMIT, String.format("Daily loss limit reached: %.2f", pnlToday));
        }

        double drawdown = capital.drawdown();
        if (drawdown > limits.getMaxDrawdown()) {
            return reject(RiskRejection.MAX_DRAWDOWN, String.format("Maximum drawdown exceeded: %.2f%% > %.2f%%",
                    drawdown * 100, limits.getMaxDrawdown() * 100));
        }

        double afterFee = current - entryFee;
        if (afterFee <= 0) {
            return reject(RiskRejection.INSUFFICIENT_CAPITAL, "No capital available after fee: " + afterFee);
        }

        double positionFraction = price * size / afterFee;
        if (positionFraction > limits.getMaxPositionFraction() + EPSILON) {
            return reject(RiskRejection.POSITION_SIZE, String.format("Position size %.1f%% exceeds max allowed %.1f%%",
                    positionFraction * 100, limits.getMaxPositionFraction() * 100));
        }

        double totalExposure = totalExposure() / afterFee + positionFraction;
        if (totalExposure > limits.getMaxTotalExposure() + EPSILON) {
            return reject(RiskRejection.TOTAL_EXPOSURE, String.format("Total exposure %.1f%% would exceed max allowed %.1f%%",
                    totalExposure * 100, limits.getMaxTotalExposure() * 100));
        }

        if (positions.containsKey(symbol)) {
            return reject(RiskRejection.DUPLICATE_POSITION, "Position already open for " + symbol);
        }

        List<Double> candidatePrices = history(priceHistory, symbol);
        for (String openSymbol : positions.keySet()) {
            OptionalDouble correlation = correlationService.trailingCorrelation(
                    candidatePrices, history(priceHistory, openSymbol), limits.getCorrelationLookback());
            if (correlation.isPresent() && Math.abs(correlation.getAsDouble()) > limits.getCorrelationThreshold()) {
                return reject(RiskRejection.CORRELATION, String.format("Correlation between %s and %s (%.2f) exceeds threshold (%.2f)",
                        symbol, openSymbol, correlation.getAsDouble(), limits.getCorrelationThreshold()));
            }
        }

        List<Double> volatility = history(volatilityHistory, symbol);
        if (!volatility.isEmpty()) {
            double latest = volatility.get(volatility.size() - 1);
            if (latest < limits.getMinVolatility()) {
                return reject(RiskRejection.VOLATILITY, String.format("Volatility too low: %.2f%%", latest * 100));
            }
            if (latest > limits.getMaxVolatility()) {
                return reject(RiskRejection.VOLATILITY, String.format("Volatility too high: %.2f%%", latest * 100));
            }
        }

        List<Double> liquidity = history(liquidityHistory, symbol);
        if (!liquidity.isEmpty()) {
            double average = liquidity.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
            if (average < limits.getMinLiquidity()) {
                return reject(RiskRejection.LIQUIDITY, String.format("Insufficient liquidity: %,.2f", average));
            }
        }

        Instant now = clock.instant();
        Duration interval = Duration.ofSeconds(limits.getMinTradeIntervalSeconds());
        if (tradeIntervals.isInCooldown(symbol, now, interval)) {
            return reject(RiskRejection.TRADE_INTERVAL, "Minimum trade interval not passed: "
                    + tradeIntervals.elapsedSince(symbol, now).toSeconds() + "s < " + interval.toSeconds() + "s");
        }

        if (closedTrades.size() >= limits.getMinTradesForWinRate() && winRate() < limits.getMinWinRate()) {
            return reject(RiskRejection.WIN_RATE, String.format("Win rate %.1f%% below minimum %.1f%%",
                    winRate() * 100, limits.getMinWinRate() * 100));
        }

        return RiskCheckResult.ok();
    }

    @Override
    public RiskCheckResult canClose(String symbol) {
        if (symbol == null || !positions.containsKey(symbol)) {
            return reject(RiskRejection.NO_POSITION, "No open position for " + symbol);
        }
        return RiskCheckResult.ok();
    }

    @Override
    public Position open(String symbol, double price, double size, PositionSide side, Instant timestamp,
                         Double stopLoss, Double takeProfit, double entryFee) {
        if (positions.containsKey(symbol)) {
            throw new RiskPreconditionException("Position already open for " + symbol);
        }
        if (!(price > 0) || !(size > 0) || side == null) {
            throw new RiskPreconditionException("Invalid open request for " + symbol + ": " + size + " @ " + price);
        }
        rollDay();

        Position position = Position.builder()
                .symbol(symbol)
                .side(side)
                .entryPrice(price)
                .quantity(size)
                .openedAt(timestamp)
                .stopLoss(stopLoss)
                .takeProfit(takeProfit)
                .entryFee(entryFee)
                .build();
        positions.put(symbol, position);
        dailyTrades++;
        tradeIntervals.record(symbol, timestamp);
        if (entryFee != 0) {
            capital.apply(-entryFee);
        }

        log.info("Opened {} position in {}: {} @ {}", side, symbol, size, price);
        return position.toBuilder().build();
    }

    @Override
    public ClosedTrade close(String symbol, double price, Instant timestamp, double exitFee, String reason) {
        Position position = positions.get(symbol);
        if (position == null) {
            throw new RiskPreconditionException("No open position to close for " + symbol);
        }
        if (!(price > 0)) {
            throw new RiskPreconditionException("Invalid exit price for " + symbol + ": " + price);
        }
        rollDay();

        double gross = (price - position.getEntryPrice()) * position.getQuantity() * position.getSide().direction();
        double fees = position.getEntryFee() + exitFee;
        double net = gross - fees;

        positions.remove(symbol);
        // entry fee was charged at open
        capital.apply(gross - exitFee);
        dailyPnl += net;

        ClosedTrade trade = ClosedTrade.builder()
                .symbol(symbol)
                .side(position.getSide())
                .entryPrice(position.getEntryPrice())
                .exitPrice(price)
                .quantity(position.getQuantity())
                .entryTime(position.getOpenedAt())
                .exitTime(timestamp)
                .realizedPnl(net)
                .fees(fees)
                .exitReason(reason)
                .build();
        closedTrades.add(trade);

        log.info("Closed position in {}: PnL = {} ({})", symbol, net, reason);
        return trade;
    }

    @Override
    public double positionSize(double price, double stopLoss, double availableCapital) {
        if (!(price > 0) || !(availableCapital > 0)) {
            return 0.0;
        }
        double stopDistance = Math.abs(price - stopLoss);
        if (stopDistance == 0) {
            return 0.0;
        }
        double size = limits.getRiskPerTrade() * availableCapital / stopDistance;
        double maxSize = limits.getMaxPositionFraction() * availableCapital / price;
        return Math.min(size, maxSize);
    }

    @Override
    public OptionalDouble computeAtr(List<Double> highs, List<Double> lows, List<Double> closes, int period) {
        return atrService.computeAtr(highs, lows, closes, period);
    }

    @Override
    public double stopLossFor(double price, double atr, PositionSide side) {
        double distance = atr * limits.getStopLossAtrMultiplier();
        return side == PositionSide.LONG ? price - distance : price + distance;
    }

    @Override
    public double takeProfitFor(double price, double atr, PositionSide side) {
        double distance = atr * limits.getTakeProfitAtrMultiplier();
        return side == PositionSide.LONG ? price + distance : price - distance;
    }

    @Override
    public RiskMetrics riskMetrics() {
        Map<String, Double> exposure = new LinkedHashMap<>();
        positions.forEach((symbol, position) -> exposure.put(symbol, position.value()));
        return new RiskMetrics(
                Collections.unmodifiableMap(exposure),
                totalExposure(),
                capital.current(),
                capital.peak(),
                capital.drawdown(),
                effectiveDailyPnl(),
                effectiveDailyTrades(),
                winRate(),
                profitFactor(),
                avgWinLossRatio(),
                sharpeRatio());
    }

    @Override
    public void updateMarketData(String symbol, double price, Double volatility, Double liquidity) {
        if (price > 0) {
            append(priceHistory, symbol, price);
        }
        if (volatility != null) {
            append(volatilityHistory, symbol, volatility);
        }
        if (liquidity != null) {
            append(liquidityHistory, symbol, liquidity);
        }
    }

    @Override
    public void updateProtection(String symbol, Double stopLoss, Double takeProfit) {
        Position position = positions.get(symbol);
        if (position == null) {
            throw new RiskPreconditionException("No open position for " + symbol);
        }
        position.setStopLoss(stopLoss);
        position.setTakeProfit(takeProfit);
    }

    @Override
    public Optional<String> evaluateProtection(String symbol, double price) {
        Position position = positions.get(symbol);
        if (position == null) {
            return Optional.empty();
        }
        boolean isLong = position.getSide() == PositionSide.LONG;
        Double stop = position.getStopLoss();
        if (stop != null && (isLong ? price <= stop : price >= stop)) {
            return Optional.of("stop_loss");
        }
        Double target = position.getTakeProfit();
        if (target != null && (isLong ? price >= target : price <= target)) {
            return Optional.of("take_profit");
        }
        return Optional.empty();
    }

    @Override
    public Optional<Position> getPosition(String symbol) {
        return Optional.ofNullable(positions.get(symbol)).map(p -> p.toBuilder().build());
    }

    @Override
    public List<Position> openPositions() {
        return positions.values().stream().map(p -> p.toBuilder().build()).toList();
    }

    @Override
    public List<ClosedTrade> closedTrades() {
        return Collections.unmodifiableList(closedTrades);
    }

    @Override
    public double currentCapital() {
        return capital.current();
    }

    @Override
    public double peakCapital() {
        return capital.peak();
    }

    @Override
    public double drawdown() {
        return capital.drawdown();
    }

    @Override
    public RiskLimits limits() {
        return limits;
    }

    private double totalExposure() {
        return positions.values().stream().mapToDouble(Position::value).sum();
    }

    private double winRate() {
        if (closedTrades.isEmpty()) {
            return 0.0;
        }
        long wins = closedTrades.stream().filter(ClosedTrade::isWin).count();
        return (double) wins / closedTrades.size();
    }

    private OptionalDouble profitFactor() {
        double grossProfit = closedTrades.stream().mapToDouble(ClosedTrade::getRealizedPnl).filter(p -> p > 0).sum();
        double grossLoss = closedTrades.stream().mapToDouble(ClosedTrade::getRealizedPnl).filter(p -> p < 0).map(Math::abs).sum();
        if (grossLoss == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(grossProfit / grossLoss);
    }

    private OptionalDouble avgWinLossRatio() {
        OptionalDouble avgWin = closedTrades.stream().mapToDouble(ClosedTrade::getRealizedPnl).filter(p -> p > 0).average();
        OptionalDouble avgLoss = closedTrades.stream().mapToDouble(ClosedTrade::getRealizedPnl).filter(p -> p < 0).average();
        if (avgWin.isEmpty() || avgLoss.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(avgWin.getAsDouble() / Math.abs(avgLoss.getAsDouble()));
    }

    private OptionalDouble sharpeRatio() {
        if (closedTrades.size() < MIN_TRADES_FOR_SHARPE) {
            return OptionalDouble.empty();
        }
        Map<LocalDate, Double> pnlByDay = new TreeMap<>();
        for (ClosedTrade trade : closedTrades) {
            LocalDate day = trade.getExitTime().atZone(ZoneOffset.UTC).toLocalDate();
            pnlByDay.merge(day, trade.getRealizedPnl(), Double::sum);
        }
        if (pnlByDay.size() < 2) {
            return OptionalDouble.empty();
        }
        double mean = pnlByDay.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = pnlByDay.values().stream().mapToDouble(v -> Math.pow(v - mean, 2)).average().orElse(0.0);
        double std = Math.sqrt(variance);
        if (std == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Math.sqrt(TRADING_DAYS) * mean / std);
    }

    private int effectiveDailyTrades() {
        return today().equals(tradingDay) ? dailyTrades : 0;
    }

    private double effectiveDailyPnl() {
        return today().equals(tradingDay) ? dailyPnl : 0.0;
    }

    private void rollDay() {
        LocalDate today = today();
        if (!today.equals(tradingDay)) {
            log.debug("Daily risk counters reset for {} (trades={}, pnl={})", today, dailyTrades, dailyPnl);
            tradingDay = today;
            dailyTrades = 0;
            dailyPnl = 0.0;
        }
    }

    private LocalDate today() {
        return clock.instant().atZone(ZoneOffset.UTC).toLocalDate();
    }

    private void append(Map<String, Deque<Double>> histories, String symbol, double value) {
        Deque<Double> values = histories.computeIfAbsent(symbol, ignored -> new ArrayDeque<>());
        values.addLast(value);
        while (values.size() > limits.getHistoryLimit()) {
            values.removeFirst();
        }
    }

    private List<Double> history(Map<String, Deque<Double>> histories, String symbol) {
        Deque<Double> values = histories.get(symbol);
        return values == null ? List.of() : new ArrayList<>(values);
    }

    private RiskCheckResult reject(RiskRejection rejection, String detail) {
        log.warn("Risk check rejected [{}]: {}", rejection.code(), detail);
        return RiskCheckResult.reject(rejection, detail);
    }
}
