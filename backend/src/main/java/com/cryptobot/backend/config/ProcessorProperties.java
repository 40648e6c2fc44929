package com.cryptobot.backend.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "processor")
@Data
@Validated
public class ProcessorProperties {

    @Min(1)
    private int queueCapacity = 10_000;

    @Positive
    private long pollTimeoutMs = 250;

    @PositiveOrZero
    private long requeueBackoffMs = 1000;

    private boolean autoStart = true;

    private RateLimit rateLimit = new RateLimit();
    private Circuit circuit = new Circuit();
    private TransportRetry transportRetry = new TransportRetry();

    @Data
    public static class RateLimit {
        // tokens per second
        @Positive
        private double rate = 10.0;

        @DecimalMin("1.0")
        private double burst = 20.0;

        @Positive
        private long waitMs = 100;
    }

    @Data
    public static class Circuit {
        @Min(1)
        private int failureThreshold = 5;

        @Positive
        private long resetTimeoutSeconds = 60;
    }

    @Data
    public static class TransportRetry {
        @Min(1)
        private int maxAttempts = 3;

        @Positive
        private long baseDelayMs = 200;

        @PositiveOrZero
        private double jitterFactor = 0.2;
    }
}
