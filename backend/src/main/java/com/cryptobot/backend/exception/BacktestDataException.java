package com.cryptobot.backend.exception;

public class BacktestDataException extends TradingException {
    public BacktestDataException(String message) {
        super(message);
    }
}
