package com.backtestplatform.backtest.config;

import com.backtestplatform.common.consensus.ConfidenceWeightedConsensusStrategy;
import com.backtestplatform.common.consensus.ConsensusEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class BacktestConfig {

    private static final Logger log = LoggerFactory.getLogger(BacktestConfig.class);

    @Value("${backtest.producers.pool-size:8}")
    private int producerPoolSize;

    @Value("${backtest.producers.queue-capacity:1000}")
    private int producerQueueCapacity;

    /**
     * Dedicated pool for signal producer calls, so a slow producer never starves the
     * session loops running on {@code Schedulers.boundedElastic()}.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler producerScheduler() {
        log.info("[Config] Signal producer pool. size={} queueCapacity={}", producerPoolSize, producerQueueCapacity);
        return Schedulers.newBoundedElastic(producerPoolSize, producerQueueCapacity, "signal-producer");
    }

    @Bean
    public ConsensusEngine consensusEngine() {
        return new ConfidenceWeightedConsensusStrategy();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
