package com.cryptobot.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {
    private String symbol;
    private PositionSide side;
    private double entryPrice;
    private double quantity;
    private Instant openedAt;

    // Optional protection levels, attached at open or later
    private Double stopLoss;
    private Double takeProfit;

    private double entryFee;

    public double value() {
        return Math.abs(quantity) * entryPrice;
    }
}
