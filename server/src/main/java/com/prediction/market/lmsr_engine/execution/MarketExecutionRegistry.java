package com.prediction.market.lmsr_engine.execution;

import java.time.Clock;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

import com.prediction.market.lmsr_engine.engine.MarketEngine;
import com.prediction.market.lmsr_engine.entity.TradeRequest;
import com.prediction.market.lmsr_engine.entity.TradeResult;
import com.prediction.market.lmsr_engine.exception.MarketClosedException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * One {@link MarketExecutor} per market, created on first use and released
 * once the market is resolved.
 */
@Slf4j
@RequiredArgsConstructor
public class MarketExecutionRegistry {
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private final ConcurrentHashMap<String, MarketExecutor> executors = new ConcurrentHashMap<>();
    private final Set<String> released = ConcurrentHashMap.newKeySet();
    private final MarketEngine marketEngine;
    private final TradeResultStore resultStore;
    private final Clock clock;

    /**
     * @return the request's position in its market's queue
     * @throws MarketClosedException if the market's executor was released
     */
    public int submitTrade(TradeRequest request) {
        return executorFor(request.getMarketId()).submit(request);
    }

    /**
     * Enqueue like {@link #submitTrade(TradeRequest)} and hand back the final
     * result once the trade has run.
     */
    public CompletableFuture<TradeResult> submitTrackedTrade(TradeRequest request) {
        return executorFor(request.getMarketId()).submitTracked(request);
    }

    public int pendingTrades(String marketId) {
        MarketExecutor executor = executors.get(marketId);
        return executor == null ? 0 : executor.pendingTrades();
    }

    public int activeMarkets() {
        return executors.size();
    }

    /**
     * Retire a market's executor. Trades already queued still run (and fail as
     * MARKET_CLOSED on a resolved market); new submissions are refused. Must not
     * be called while holding the market lock, since draining needs it.
     */
    public void release(String marketId) {
        released.add(marketId);
        MarketExecutor executor = executors.remove(marketId);
        if (executor != null) {
            executor.shutdown(SHUTDOWN_TIMEOUT);
            log.info("Released executor of market {}", marketId);
        }
    }

    public void shutdown() {
        log.info("Draining {} market executors", executors.size());
        executors.values().forEach(executor -> executor.shutdown(SHUTDOWN_TIMEOUT));
    }

    private MarketExecutor executorFor(String marketId) {
        return executors.computeIfAbsent(marketId, id -> {
            if (released.contains(id)) {
                throw new MarketClosedException("Market " + id + " is no longer accepting trades");
            }
            return new MarketExecutor(id, marketEngine, resultStore, clock);
        });
    }
}
