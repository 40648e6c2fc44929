package com.cryptobot.backend.service.risk;

/**
 * Reasons a trade can be refused. Expected, frequent and never thrown.
 */
public enum RiskRejection {
    INVALID_ORDER("invalid_order"),
    DAILY_TRADE_LIMIT("daily_trade_limit"),
    DAILY_LOSS_LIMIT("daily_loss_limit"),
    MAX_DRAWDOWN("max_drawdown"),
    INSUFFICIENT_CAPITAL("insufficient_capital"),
    POSITION_SIZE("position_size"),
    TOTAL_EXPOSURE("total_exposure"),
    DUPLICATE_POSITION("duplicate_position"),
    CORRELATION("correlation"),
    VOLATILITY("volatility"),
    LIQUIDITY("liquidity"),
    TRADE_INTERVAL("trade_interval"),
    WIN_RATE("win_rate"),
    NO_POSITION("no_position"),
    ORDER_INTERVAL("order_interval"),
    PENDING_ORDER("pending_order"),
    CIRCUIT_OPEN("circuit_open");

    private final String code;

    RiskRejection(String code) {
        this.code = code;
    }

    /** Stable lowercase tag used in metrics and logs. */
    public String code() {
        return code;
    }
}
