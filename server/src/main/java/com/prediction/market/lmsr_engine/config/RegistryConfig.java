package com.prediction.market.lmsr_engine.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.prediction.market.lmsr_engine.engine.MarketEngine;
import com.prediction.market.lmsr_engine.execution.MarketExecutionRegistry;
import com.prediction.market.lmsr_engine.execution.TradeResultStore;

@Configuration
public class RegistryConfig {

    @Bean
    public TradeResultStore tradeResultStore(MarketProperties properties, Clock clock) {
        return new TradeResultStore(properties.getResultTtl(), properties.getMaxResults(), clock);
    }

    /**
     * Queued trades are drained when the context closes.
     */
    @Bean(destroyMethod = "shutdown")
    public MarketExecutionRegistry marketExecutionRegistry(MarketEngine marketEngine, TradeResultStore resultStore,
            Clock clock) {
        return new MarketExecutionRegistry(marketEngine, resultStore, clock);
    }
}
