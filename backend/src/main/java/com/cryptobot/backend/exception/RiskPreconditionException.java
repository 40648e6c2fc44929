package com.cryptobot.backend.exception;

/**
 * Raised when ledger mutations are attempted without their paired passing check,
 * e.g. closing a symbol that has no open position. Not recoverable.
 */
public class RiskPreconditionException extends TradingException {
    public RiskPreconditionException(String message) {
        super(message);
    }
}
