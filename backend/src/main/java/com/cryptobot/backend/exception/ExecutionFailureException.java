package com.cryptobot.backend.exception;

public class ExecutionFailureException extends TradingException {
    public ExecutionFailureException(String message) {
        super(message);
    }

    public ExecutionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
