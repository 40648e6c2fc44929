package com.cryptobot.backend.service.execution;

import com.cryptobot.backend.service.risk.RiskRejection;

public record OrderResult(boolean success, String orderId, RiskRejection rejection, String message) {

    public static OrderResult accepted(String orderId) {
        return new OrderResult(true, orderId, null, null);
    }

    public static OrderResult rejected(String orderId, RiskRejection rejection, String message) {
        return new OrderResult(false, orderId, rejection, message);
    }
}
