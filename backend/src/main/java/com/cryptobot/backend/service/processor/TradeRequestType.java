package com.cryptobot.backend.service.processor;

public enum TradeRequestType {
    ORDER(true),
    CANCEL(true),
    SIGNAL(true),
    // Settlement of orders already sent; never dropped by an open breaker
    FILL(false),
    FILL_FAILED(false);

    private final boolean gatedByCircuit;

    TradeRequestType(boolean gatedByCircuit) {
        this.gatedByCircuit = gatedByCircuit;
    }

    public boolean isGatedByCircuit() {
        return gatedByCircuit;
    }
}
