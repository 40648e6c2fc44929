package com.cryptobot.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "strategy")
@Data
public class StrategyProperties {

    private Rsi rsi = new Rsi();
    private Exit exit = new Exit();

    @Data
    public static class Rsi {
        private double overbought = 70.0;
        private double oversold = 30.0;
    }

    @Data
    public static class Exit {
        private boolean enforceStops = false;
        // Stop distance as a fraction of price when ATR is not yet available
        private double fallbackStopPct = 0.05;
    }
}
