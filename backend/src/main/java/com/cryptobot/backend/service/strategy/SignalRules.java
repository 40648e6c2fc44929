package com.cryptobot.backend.service.strategy;

import com.cryptobot.backend.config.StrategyProperties;
import com.cryptobot.backend.model.MarketSignal;
import com.cryptobot.backend.model.Position;
import com.cryptobot.backend.model.PositionSide;
import com.cryptobot.backend.service.risk.RiskManager;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Entry and exit rules shared by the live signal path and the backtest replay.
 */
@Component
@RequiredArgsConstructor
public class SignalRules {

    public static final String MOMENTUM_REVERSAL = "momentum_reversal";
    public static final String SUPPORT_BREAK = "support_break";
    public static final String RESISTANCE_BREAK = "resistance_break";
    public static final String TREND_REVERSAL = "trend_reversal";

    private final StrategyProperties strategyProperties;

    public Optional<PositionSide> entrySignal(MarketSignal signal) {
        StrategyProperties.Rsi rsi = strategyProperties.getRsi();
        if (signal.trend() == null) {
            return Optional.empty();
        }
        if (signal.rsi() < rsi.getOversold()
                && signal.macd() > signal.macdSignal()
                && signal.price() > signal.support()
                && signal.trend().isUp()) {
            return Optional.of(PositionSide.LONG);
        }
        if (signal.rsi() > rsi.getOverbought()
                && signal.macd() < signal.macdSignal()
                && signal.price() < signal.resistance()
                && signal.trend().isDown()) {
            return Optional.of(PositionSide.SHORT);
        }
        return Optional.empty();
    }

    public Optional<String> exitSignal(Position position, MarketSignal signal) {
        StrategyProperties.Rsi rsi = strategyProperties.getRsi();
        if (position.getSide() == PositionSide.LONG) {
            if (signal.rsi() > rsi.getOverbought() && signal.macd() < signal.macdSignal()) {
                return Optional.of(MOMENTUM_REVERSAL);
            }
            if (signal.price() < signal.support()) {
                return Optional.of(SUPPORT_BREAK);
            }
            if (signal.trend() != null && signal.trend().isDown()) {
                return Optional.of(TREND_REVERSAL);
            }
        } else {
            if (signal.rsi() < rsi.getOversold() && signal.macd() > signal.macdSignal()) {
                return Optional.of(MOMENTUM_REVERSAL);
            }
            if (signal.price() > signal.resistance()) {
                return Optional.of(RESISTANCE_BREAK);
            }
            if (signal.trend() != null && signal.trend().isUp()) {
                return Optional.of(TREND_REVERSAL);
            }
        }
        return Optional.empty();
    }

    /**
     * ATR-based stop when ATR is known, otherwise a fixed fraction of price.
     */
    public double initialStop(double price, OptionalDouble atr, PositionSide side, RiskManager riskManager) {
        if (atr.isPresent() && atr.getAsDouble() > 0) {
            return riskManager.stopLossFor(price, atr.getAsDouble(), side);
        }
        double distance = price * strategyProperties.getExit().getFallbackStopPct();
        return side == PositionSide.LONG ? price - distance : price + distance;
    }

    public Double initialTarget(double price, OptionalDouble atr, PositionSide side, RiskManager riskManager) {
        if (atr.isPresent() && atr.getAsDouble() > 0) {
            return riskManager.takeProfitFor(price, atr.getAsDouble(), side);
        }
        return null;
    }

    /**
     * Sizes an entry against capital net of its own entry fee, so the position still fits the
     * exposure limits once the fee has been charged.
     */
    public double entrySize(double price, double stop, double feeRate, RiskManager riskManager) {
        double fundable = riskManager.currentCapital() / (1 + Math.max(feeRate, 0.0));
        return riskManager.positionSize(price, stop, fundable);
    }

    public boolean enforceStops() {
        return strategyProperties.getExit().isEnforceStops();
    }
}
