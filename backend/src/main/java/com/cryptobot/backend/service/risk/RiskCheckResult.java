package com.cryptobot.backend.service.risk;

public record RiskCheckResult(boolean allowed, RiskRejection rejection, String detail) {

    private static final RiskCheckResult OK = new RiskCheckResult(true, null, "Allowed");

    public static RiskCheckResult ok() {
        return OK;
    }

    public static RiskCheckResult reject(RiskRejection rejection, String detail) {
        return new RiskCheckResult(false, rejection, detail);
    }
}
