package com.cryptobot.backend.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

@Value
@Builder
public class ClosedTrade {
    String symbol;
    PositionSide side;
    double entryPrice;
    double exitPrice;
    double quantity;
    Instant entryTime;
    Instant exitTime;

    /** Net of entry and exit fees. */
    double realizedPnl;
    double fees;
    String exitReason;

    public boolean isWin() {
        return realizedPnl > 0;
    }

    public Duration holdingTime() {
        return Duration.between(entryTime, exitTime);
    }
}
