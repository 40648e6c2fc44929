package com.cryptobot.backend.config;

import com.cryptobot.backend.service.LoggingTradeRecorder;
import com.cryptobot.backend.service.MetricsService;
import com.cryptobot.backend.service.TradeRecorder;
import com.cryptobot.backend.service.execution.OrderExecutionHandler;
import com.cryptobot.backend.service.execution.OrderExecutor;
import com.cryptobot.backend.service.execution.OrderStateMachine;
import com.cryptobot.backend.service.execution.PaperTradeTransport;
import com.cryptobot.backend.service.execution.TradeTransport;
import com.cryptobot.backend.service.indicator.AtrService;
import com.cryptobot.backend.service.processor.DeadLetterQueueService;
import com.cryptobot.backend.service.processor.TokenBucketRateLimiter;
import com.cryptobot.backend.service.processor.TradeCircuitBreaker;
import com.cryptobot.backend.service.processor.TradeProcessor;
import com.cryptobot.backend.service.risk.CorrelationService;
import com.cryptobot.backend.service.risk.DefaultRiskManager;
import com.cryptobot.backend.service.risk.RiskManager;
import com.cryptobot.backend.service.strategy.SignalHandler;
import com.cryptobot.backend.service.strategy.SignalRules;
import com.cryptobot.backend.service.strategy.TradeSignalService;
import io.github.resilience4j.retry.Retry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Live engine wiring. The live {@link RiskManager} is only ever touched by the processor's consumer.
 */
@Configuration
public class TradingEngineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RiskManager liveRiskManager(RiskProperties riskProperties, Clock clock,
                                       CorrelationService correlationService, AtrService atrService) {
        return new DefaultRiskManager(riskProperties.toLimits(), riskProperties.getInitialCapital(),
                clock, correlationService, atrService);
    }

    @Bean
    @ConditionalOnMissingBean
    public TradeRecorder tradeRecorder() {
        return new LoggingTradeRecorder();
    }

    @Bean
    @ConditionalOnMissingBean
    public TradeTransport tradeTransport(Clock clock) {
        return new PaperTradeTransport(clock);
    }

    @Bean
    public OrderExecutor orderExecutor(RiskManager riskManager, TradeRecorder tradeRecorder,
                                       MetricsService metricsService, ExecutionProperties executionProperties,
                                       Clock clock) {
        return new OrderExecutor(riskManager, new OrderStateMachine(clock), tradeRecorder, metricsService, clock,
                executionProperties.getMaxSlippage(),
                Duration.ofSeconds(executionProperties.getMinOrderIntervalSeconds()),
                executionProperties.getFeeRate());
    }

    @Bean
    public TokenBucketRateLimiter tradeRateLimiter(ProcessorProperties processorProperties) {
        ProcessorProperties.RateLimit rateLimit = processorProperties.getRateLimit();
        return new TokenBucketRateLimiter(rateLimit.getRate(), rateLimit.getBurst());
    }

    @Bean
    public TradeCircuitBreaker tradeCircuitBreaker(ProcessorProperties processorProperties, Clock clock) {
        ProcessorProperties.Circuit circuit = processorProperties.getCircuit();
        return new TradeCircuitBreaker(circuit.getFailureThreshold(),
                Duration.ofSeconds(circuit.getResetTimeoutSeconds()), clock);
    }

    @Bean
    public DeadLetterQueueService deadLetterQueueService(MetricsService metricsService, Clock clock) {
        return new DeadLetterQueueService(metricsService, clock);
    }

    @Bean
    public TradeProcessor tradeProcessor(ProcessorProperties processorProperties,
                                         TokenBucketRateLimiter tradeRateLimiter,
                                         TradeCircuitBreaker tradeCircuitBreaker,
                                         MetricsService metricsService,
                                         DeadLetterQueueService deadLetterQueueService,
                                         Clock clock) {
        return new TradeProcessor(processorProperties.getQueueCapacity(),
                tradeRateLimiter,
                tradeCircuitBreaker,
                metricsService,
                deadLetterQueueService,
                clock,
                Duration.ofMillis(processorProperties.getPollTimeoutMs()),
                Duration.ofMillis(processorProperties.getRequeueBackoffMs()),
                Duration.ofMillis(processorProperties.getRateLimit().getWaitMs()),
                processorProperties.isAutoStart());
    }

    @Bean
    public OrderExecutionHandler orderExecutionHandler(TradeProcessor tradeProcessor, OrderExecutor orderExecutor,
                                                       TradeTransport tradeTransport, Retry tradeTransportRetry) {
        OrderExecutionHandler handler = new OrderExecutionHandler(orderExecutor, tradeTransport,
                tradeTransportRetry, tradeProcessor::enqueue);
        tradeProcessor.registerHandler("order-execution", handler);
        return handler;
    }

    @Bean
    public SignalHandler signalHandler(TradeProcessor tradeProcessor, RiskManager riskManager,
                                       SignalRules signalRules, ExecutionProperties executionProperties) {
        SignalHandler handler = new SignalHandler(riskManager, signalRules,
                executionProperties.getMinSignalConfidence(), executionProperties.getFeeRate(), tradeProcessor::enqueue);
        tradeProcessor.registerHandler("signals", handler);
        return handler;
    }

    @Bean
    public TradeSignalService tradeSignalService(TradeProcessor tradeProcessor) {
        return new TradeSignalService(tradeProcessor);
    }
}
