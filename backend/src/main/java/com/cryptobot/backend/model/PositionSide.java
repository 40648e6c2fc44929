package com.cryptobot.backend.model;

public enum PositionSide {
    LONG,
    SHORT;

    /**
     * +1 for long, -1 for short. Multiplies (exit - entry) into a signed P&L.
     */
    public int direction() {
        return this == LONG ? 1 : -1;
    }
}
