package com.cryptobot.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "backtest")
@Data
@Validated
public class BacktestProperties {

    @Positive
    private double initialCapital = 100.0;

    // 0.05% per fill
    @PositiveOrZero
    private double feeRate = 0.0005;

    @Min(1)
    private int periodsPerYear = 252;

    @PositiveOrZero
    private double annualRiskFreeRate = 0.02;
}
