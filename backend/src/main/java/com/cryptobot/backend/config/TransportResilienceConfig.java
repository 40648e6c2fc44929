package com.cryptobot.backend.config;

import com.cryptobot.backend.exception.RiskPreconditionException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class TransportResilienceConfig {

    @Bean
    public Retry tradeTransportRetry(ProcessorProperties processorProperties) {
        ProcessorProperties.TransportRetry retry = processorProperties.getTransportRetry();
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                Duration.ofMillis(retry.getBaseDelayMs()),
                2.0,
                retry.getJitterFactor()
        );
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(retry.getMaxAttempts())
                .intervalFunction(intervalFunction)
                .retryExceptions(RuntimeException.class)
                .ignoreExceptions(RiskPreconditionException.class, IllegalArgumentException.class)
                .build();
        return Retry.of("trade-transport", config);
    }
}
