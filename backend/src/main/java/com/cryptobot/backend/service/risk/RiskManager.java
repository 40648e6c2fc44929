package com.cryptobot.backend.service.risk;

import com.cryptobot.backend.model.ClosedTrade;
import com.cryptobot.backend.model.Position;
import com.cryptobot.backend.model.PositionSide;
import com.cryptobot.backend.model.RiskLimits;
import com.cryptobot.backend.model.RiskMetrics;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Capital and position ledger with one set of gating rules.
 * <p>
 * Checks are read-only and never throw. Mutations ({@link #open}, {@link #close}) must only follow a
 * passing check; calling them otherwise raises
 * {@link com.cryptobot.backend.exception.RiskPreconditionException}.
 */
public interface RiskManager {

    /**
     * Exposure limits are measured against capital net of {@code entryFee}, the capital the position
     * will actually be held against once {@link #open} charges the fee.
     */
    RiskCheckResult canOpen(String symbol, double price, double size, double entryFee);

    default RiskCheckResult canOpen(String symbol, double price, double size) {
        return canOpen(symbol, price, size, 0.0);
    }

    RiskCheckResult canClose(String symbol);

    Position open(String symbol, double price, double size, PositionSide side, Instant timestamp,
                  Double stopLoss, Double takeProfit, double entryFee);

    default Position open(String symbol, double price, double size, PositionSide side, Instant timestamp,
                          Double stopLoss, Double takeProfit) {
        return open(symbol, price, size, side, timestamp, stopLoss, takeProfit, 0.0);
    }

    ClosedTrade close(String symbol, double price, Instant timestamp, double exitFee, String reason);

    default ClosedTrade close(String symbol, double price, Instant timestamp) {
        return close(symbol, price, timestamp, 0.0, "signal");
    }

    double positionSize(double price, double stopLoss, double availableCapital);

    OptionalDouble computeAtr(List<Double> highs, List<Double> lows, List<Double> closes, int period);

    double stopLossFor(double price, double atr, PositionSide side);

    double takeProfitFor(double price, double atr, PositionSide side);

    RiskMetrics riskMetrics();

    void updateMarketData(String symbol, double price, Double volatility, Double liquidity);

    void updateProtection(String symbol, Double stopLoss, Double takeProfit);

    Optional<String> evaluateProtection(String symbol, double price);

    Optional<Position> getPosition(String symbol);

    List<Position> openPositions();

    List<ClosedTrade> closedTrades();

    double currentCapital();

    double peakCapital();

    double drawdown();

    RiskLimits limits();
}
