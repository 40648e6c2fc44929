package com.cryptobot.backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "execution")
@Data
@Validated
public class ExecutionProperties {

    // 0.1% of requested price
    @Positive
    private double maxSlippage = 0.001;

    @PositiveOrZero
    private long minOrderIntervalSeconds = 60;

    @PositiveOrZero
    private double feeRate = 0.0;

    // Signals below this confidence are ignored by the live signal path
    @PositiveOrZero
    @DecimalMax("1.0")
    private double minSignalConfidence = 0.7;
}
