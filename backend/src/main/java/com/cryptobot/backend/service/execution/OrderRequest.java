package com.cryptobot.backend.service.execution;

import com.cryptobot.backend.model.OrderAction;
import com.cryptobot.backend.model.PositionSide;
import lombok.Builder;

/**
 * A request to open or close a position. For CLOSE the side is taken from the open position and a
 * non-positive size means "the whole position".
 */
@Builder
public record OrderRequest(
        String symbol,
        PositionSide side,
        OrderAction action,
        double price,
        double size,
        Double stopLoss,
        Double takeProfit,
        String reason
) {}
