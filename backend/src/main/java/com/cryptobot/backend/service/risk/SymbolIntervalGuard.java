package com.cryptobot.backend.service.risk;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers the last activity time per symbol and answers "is this symbol still cooling down".
 * Symbols are matched exactly, the same way positions and orders are keyed.
 */
public class SymbolIntervalGuard {

    private final Map<String, Instant> lastActivityBySymbol = new ConcurrentHashMap<>();

    public void record(String symbol, Instant at) {
        if (symbol == null || symbol.isBlank() || at == null) {
            return;
        }
        lastActivityBySymbol.put(symbol, at);
    }

    public void clear(String symbol) {
        if (symbol != null) {
            lastActivityBySymbol.remove(symbol);
        }
    }

    public boolean isInCooldown(String symbol, Instant now, Duration interval) {
        if (symbol == null || symbol.isBlank() || interval.isZero() || interval.isNegative()) {
            return false;
        }
        Instant last = lastActivityBySymbol.get(symbol);
        if (last == null) {
            return false;
        }
        return Duration.between(last, now).compareTo(interval) < 0;
    }

    public Duration elapsedSince(String symbol, Instant now) {
        Instant last = lastActivityBySymbol.get(symbol);
        return last == null ? null : Duration.between(last, now);
    }
}
