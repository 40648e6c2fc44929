package com.cryptobot.backend.config;

import com.cryptobot.backend.model.RiskLimits;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "risk")
@Data
@Validated
public class RiskProperties {

    @Positive
    private double initialCapital = 1000.0;

    private Limits limits = new Limits();
    private Atr atr = new Atr();
    private Correlation correlation = new Correlation();

    @Data
    public static class Limits {
        @Positive
        @DecimalMax("1.0")
        private double maxPositionFraction = 0.1;

        @Positive
        private double maxTotalExposure = 0.5;

        @Positive
        @DecimalMax("1.0")
        private double maxDrawdown = 0.15;

        @Positive
        @DecimalMax("1.0")
        private double riskPerTrade = 0.02;

        @Min(1)
        private int maxDailyTrades = 10;

        @Positive
        private double maxDailyLoss = 0.05;

        @PositiveOrZero
        private double minVolatility = 0.01;

        @Positive
        private double maxVolatility = 0.05;

        @PositiveOrZero
        private double minLiquidity = 1_000_000.0;

        @PositiveOrZero
        private long minTradeIntervalSeconds = 300;

        @PositiveOrZero
        private double minWinRate = 0.4;

        @Min(1)
        private int minTradesForWinRate = 10;
    }

    @Data
    public static class Atr {
        @Min(1)
        private int period = 14;

        @Positive
        private double stopMultiplier = 2.0;

        @Positive
        private double takeProfitMultiplier = 3.0;
    }

    @Data
    public static class Correlation {
        @Positive
        private double threshold = 0.7;

        @Min(2)
        private int lookback = 30;

        @Min(2)
        private int historyLimit = 100;
    }

    public RiskLimits toLimits() {
        return RiskLimits.builder()
                .maxPositionFraction(limits.getMaxPositionFraction())
                .maxTotalExposure(limits.getMaxTotalExposure())
                .maxDrawdown(limits.getMaxDrawdown())
                .riskPerTrade(limits.getRiskPerTrade())
                .maxDailyTrades(limits.getMaxDailyTrades())
                .maxDailyLoss(limits.getMaxDailyLoss())
                .minVolatility(limits.getMinVolatility())
                .maxVolatility(limits.getMaxVolatility())
                .minLiquidity(limits.getMinLiquidity())
                .minTradeIntervalSeconds(limits.getMinTradeIntervalSeconds())
                .minWinRate(limits.getMinWinRate())
                .minTradesForWinRate(limits.getMinTradesForWinRate())
                .atrPeriod(atr.getPeriod())
                .stopLossAtrMultiplier(atr.getStopMultiplier())
                .takeProfitAtrMultiplier(atr.getTakeProfitMultiplier())
                .correlationThreshold(correlation.getThreshold())
                .correlationLookback(correlation.getLookback())
                .historyLimit(correlation.getHistoryLimit())
                .build();
    }
}
