package com.cryptobot.backend.service.execution;

import com.cryptobot.backend.model.Order;
import com.cryptobot.backend.model.OrderStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

@Slf4j
@RequiredArgsConstructor
public class OrderStateMachine {

    private final Clock clock;

    /**
     * @return false when the order is already terminal or the move is not allowed
     */
    public boolean transition(Order order, OrderStatus target, String reason) {
        if (order == null || target == null) {
            return false;
        }
        OrderStatus current = order.getStatus();
        if (current == null || !current.canTransitionTo(target)) {
            log.debug("Ignoring order {} transition {} -> {}", order.getId(), current, target);
            return false;
        }
        order.setStatus(target);
        order.setStatusReason(reason);
        order.setUpdatedAt(clock.instant());
        log.info("Order {} [{}] {} -> {} ({})", order.getId(), order.getSymbol(), current, target, reason);
        return true;
    }
}
