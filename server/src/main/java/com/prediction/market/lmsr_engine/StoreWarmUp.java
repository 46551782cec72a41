package com.prediction.market.lmsr_engine;

import org.springframework.stereotype.Component;

import com.prediction.market.lmsr_engine.cache.MarketStore;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads persisted markets into memory before the first trade arrives. Fails
 * startup when MongoDB is unreachable.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StoreWarmUp {

    private final MarketStore marketStore;

    @PostConstruct
    public void warmUp() {
        try {
            int loaded = marketStore.warmUp();
            log.info("MongoDB connection successful, {} markets loaded", loaded);
        } catch (Exception e) {
            throw new IllegalStateException("MongoDB connection failed", e);
        }
    }
}
