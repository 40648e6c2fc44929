package com.cryptobot.backend.model;

public enum Trend {
    STRONG_UPTREND,
    WEAK_UPTREND,
    SIDEWAYS,
    WEAK_DOWNTREND,
    STRONG_DOWNTREND;

    public boolean isUp() {
        return this == STRONG_UPTREND || this == WEAK_UPTREND;
    }

    public boolean isDown() {
        return this == STRONG_DOWNTREND || this == WEAK_DOWNTREND;
    }
}
