package com.cryptobot.backend.service;

import com.cryptobot.backend.model.ClosedTrade;

/**
 * Write-only sink for trade history. Implementations must not throw back into the caller.
 */
public interface TradeRecorder {

    void record(ClosedTrade trade);
}
