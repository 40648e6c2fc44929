package com.cryptobot.backend.model;

/**
 * Order lifecycle: PENDING moves to exactly one terminal state.
 */
public enum OrderStatus {
    PENDING,
    FILLED,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    public boolean canTransitionTo(OrderStatus target) {
        if (target == null) return false;
        return this == PENDING && target.isTerminal();
    }
}
