package com.cryptobot.backend.service.strategy;

import com.cryptobot.backend.model.MarketSignal;
import com.cryptobot.backend.model.Position;
import com.cryptobot.backend.model.PositionSide;
import com.cryptobot.backend.service.processor.TradeHandler;
import com.cryptobot.backend.service.processor.TradeRequest;
import com.cryptobot.backend.service.processor.TradeRequestType;
import com.cryptobot.backend.service.risk.RiskManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Consumer;

/**
 * Turns live market signals into order requests. Runs on the processor's consumer thread so the
 * market history it feeds is only ever written there.
 */
@Slf4j
@RequiredArgsConstructor
public class SignalHandler implements TradeHandler {

    private final RiskManager riskManager;
    private final SignalRules signalRules;
    private final double minSignalConfidence;
    private final double feeRate;
    private final Consumer<TradeRequest> orderSink;

    @Override
    public void handle(TradeRequest request) {
        if (request.getType() != TradeRequestType.SIGNAL) {
            return;
        }
        MarketSignal signal = request.getSignal();
        String symbol = signal.symbol();
        riskManager.updateMarketData(symbol, signal.price(), signal.volatility(), signal.liquidity());

        Optional<Position> open = riskManager.getPosition(symbol);
        if (open.isPresent()) {
            Optional<String> exit = signalRules.exitSignal(open.get(), signal);
            if (exit.isEmpty() && signalRules.enforceStops()) {
                exit = riskManager.evaluateProtection(symbol, signal.price());
            }
            exit.ifPresent(reason -> {
                log.info("Exit signal for {}: {}", symbol, reason);
                orderSink.accept(TradeRequest.close(symbol, signal.price(), reason));
            });
            return;
        }

        if (signal.confidence() != null && signal.confidence() < minSignalConfidence) {
            log.debug("Ignoring {} signal with confidence {}", symbol, signal.confidence());
            return;
        }

        signalRules.entrySignal(signal).ifPresent(side -> enter(signal, side));
    }

    private void enter(MarketSignal signal, PositionSide side) {
        double price = signal.price();
        OptionalDouble atr = signal.atr() != null ? OptionalDouble.of(signal.atr()) : OptionalDouble.empty();
        double stop = signalRules.initialStop(price, atr, side, riskManager);
        Double target = signalRules.initialTarget(price, atr, side, riskManager);
        double size = signalRules.entrySize(price, stop, feeRate, riskManager);
        if (size <= 0) {
            log.debug("Zero size for {} entry at {}", signal.symbol(), price);
            return;
        }
        log.info("Entry signal for {}: {} {} @ {} (stop {})", signal.symbol(), side, size, price, stop);
        orderSink.accept(TradeRequest.open(signal.symbol(), side, price, size, stop, target));
    }
}
