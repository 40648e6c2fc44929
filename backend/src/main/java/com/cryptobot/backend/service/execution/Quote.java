package com.cryptobot.backend.service.execution;

import com.cryptobot.backend.model.OrderAction;
import com.cryptobot.backend.model.PositionSide;

import java.time.Instant;

/**
 * Executable price for an order, tagged with the client order id so the fill can be matched back.
 */
public record Quote(String clientOrderId, String symbol, PositionSide side, OrderAction action,
                    double size, double price, Instant quotedAt) {}
