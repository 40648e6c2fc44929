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
public class Order {
    private String id;
    private String symbol;
    private PositionSide side;
    private OrderAction action;
    private double requestedPrice;
    private double requestedSize;
    private OrderStatus status;
    private Instant createdAt;
    private Instant updatedAt;
    private Double stopLoss;
    private Double takeProfit;
    private Double filledPrice;
    private Double filledQuantity;
    private String statusReason;
    // exit reason carried to the closed trade for CLOSE orders
    private String reason;

    public boolean isPending() {
        return status == OrderStatus.PENDING;
    }
}
