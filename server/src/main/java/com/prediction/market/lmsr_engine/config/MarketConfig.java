package com.prediction.market.lmsr_engine.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.prediction.market.lmsr_engine.cache.BetStore;
import com.prediction.market.lmsr_engine.cache.MarketStore;
import com.prediction.market.lmsr_engine.engine.MarketEngine;
import com.prediction.market.lmsr_engine.engine.PricingEngine;
import com.prediction.market.lmsr_engine.repositories.BetRepository;
import com.prediction.market.lmsr_engine.repositories.MarketRepository;
import com.prediction.market.lmsr_engine.repositories.MarketStateRepository;
import com.prediction.market.lmsr_engine.service.LedgerService;
import com.prediction.market.lmsr_engine.service.TradeValidator;

@Configuration
@EnableScheduling
@EnableConfigurationProperties(MarketProperties.class)
public class MarketConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MarketStore marketStore(MarketRepository marketRepository, MarketStateRepository marketStateRepository,
            MarketProperties properties, Clock clock) {
        return new MarketStore(marketRepository, marketStateRepository, properties, clock);
    }

    @Bean
    public BetStore betStore(BetRepository betRepository, MarketStore marketStore) {
        return new BetStore(betRepository, marketStore);
    }

    @Bean
    PricingEngine pricingEngine() {
        return new PricingEngine();
    }

    @Bean
    public TradeValidator tradeValidator(MarketProperties properties) {
        return new TradeValidator(properties);
    }

    @Bean
    public MarketEngine marketEngine(MarketStore marketStore, BetStore betStore, LedgerService ledgerService,
            PricingEngine pricingEngine, Clock clock) {
        return new MarketEngine(marketStore, betStore, ledgerService, pricingEngine, clock);
    }
}
