package com.cryptobot.backend.service;

import com.cryptobot.backend.model.ClosedTrade;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

/**
 * Appends each closed trade as one JSON line to the {@code TRADE_HISTORY} logger.
 */
@Slf4j(topic = "TRADE_HISTORY")
public class LoggingTradeRecorder implements TradeRecorder {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Override
    public void record(ClosedTrade trade) {
        log.info(toJson(trade));
    }

    String toJson(ClosedTrade trade) {
        try {
            return objectMapper.writeValueAsString(trade);
        } catch (JsonProcessingException e) {
            log.warn("Trade record for {} could not be serialized: {}", trade.getSymbol(), e.getMessage());
            return "{\"symbol\":\"" + trade.getSymbol() + "\"}";
        }
    }
}
