package com.cryptobot.backend.service.processor;

import com.cryptobot.backend.service.risk.RiskRejection;

public record TradeOutcome(String requestId, Status status, String orderId, RiskRejection rejection, String detail) {

    public enum Status {
        SUCCEEDED,
        REJECTED,
        FAILED
    }

    public boolean succeeded() {
        return status == Status.SUCCEEDED;
    }
}
