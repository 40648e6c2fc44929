package com.cryptobot.backend;

import com.cryptobot.backend.config.RiskProperties;
import com.cryptobot.backend.service.execution.PaperTradeTransport;
import com.cryptobot.backend.service.execution.TradeTransport;
import com.cryptobot.backend.service.processor.TradeProcessor;
import com.cryptobot.backend.service.risk.RiskManager;
import io.github.resilience4j.retry.Retry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "processor.auto-start=false",
        "risk.initial-capital=2500",
        "processor.transport-retry.max-attempts=4"
})
class TradingEngineApplicationTest {

    @Autowired
    private RiskManager riskManager;

    @Autowired
    private RiskProperties riskProperties;

    @Autowired
    private TradeProcessor tradeProcessor;

    @Autowired
    private TradeTransport tradeTransport;

    @Autowired
    private Retry tradeTransportRetry;

    @Test
    void wiresLiveEngineFromProperties() {
        assertThat(riskProperties.getInitialCapital()).isEqualTo(2500.0);
        assertThat(riskManager.currentCapital()).isEqualTo(2500.0);
        assertThat(riskManager.limits().getMaxPositionFraction()).isEqualTo(0.1);
        assertThat(tradeTransport).isInstanceOf(PaperTradeTransport.class);
        assertThat(tradeTransportRetry.getRetryConfig().getMaxAttempts()).isEqualTo(4);
        assertThat(tradeProcessor.isRunning()).isFalse();
    }
}
