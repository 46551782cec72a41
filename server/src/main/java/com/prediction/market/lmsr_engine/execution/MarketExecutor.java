package com.prediction.market.lmsr_engine.execution;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.prediction.market.lmsr_engine.engine.MarketEngine;
import com.prediction.market.lmsr_engine.entity.TradeRequest;
import com.prediction.market.lmsr_engine.entity.TradeResult;
import com.prediction.market.lmsr_engine.exception.ErrorKind;
import com.prediction.market.lmsr_engine.exception.MarketClosedException;
import com.prediction.market.lmsr_engine.exception.MarketException;

import lombok.extern.slf4j.Slf4j;

/**
 * Serial queue of one market. A single worker thread takes requests in
 * submission order, so trades on a market never overlap; other markets have
 * their own executor and proceed in parallel.
 */
@Slf4j
public class MarketExecutor {
    private final String marketId;
    private final ExecutorService executor;
    private final AtomicInteger pending = new AtomicInteger();
    private final MarketEngine marketEngine;
    private final TradeResultStore resultStore;
    private final Clock clock;

    public MarketExecutor(String marketId, MarketEngine marketEngine, TradeResultStore resultStore, Clock clock) {
        this.marketId = marketId;
        this.marketEngine = marketEngine;
        this.resultStore = resultStore;
        this.clock = clock;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "market-" + marketId);
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Enqueue a request and register its QUEUED result. Positions are handed
     * out in the same order the requests enter the queue.
     *
     * @return 1-based position in this market's queue at submission time
     */
    public synchronized int submit(TradeRequest request) {
        return enqueue(request, null);
    }

    /**
     * As {@link #submit(TradeRequest)}, also returning the final result once
     * the trade has run.
     */
    public synchronized CompletableFuture<TradeResult> submitTracked(TradeRequest request) {
        CompletableFuture<TradeResult> completion = new CompletableFuture<>();
        enqueue(request, completion);
        return completion;
    }

    private int enqueue(TradeRequest request, CompletableFuture<TradeResult> completion) {
        int position = pending.incrementAndGet();
        TradeRequest queued = request.toBuilder().queuePosition(position).build();
        resultStore.register(TradeResult.queued(queued));
        try {
            executor.execute(() -> {
                TradeResult result = run(queued);
                if (completion != null) {
                    completion.complete(result);
                }
            });
        } catch (RejectedExecutionException e) {
            pending.decrementAndGet();
            resultStore.discard(queued.getRequestId());
            throw new MarketClosedException("Market " + marketId + " is no longer accepting trades");
        }
        return position;
    }

    public int pendingTrades() {
        return pending.get();
    }

    private TradeResult run(TradeRequest request) {
        TradeResult queued = TradeResult.queued(request);
        resultStore.update(queued.processing());

        TradeResult result;
        try {
            result = marketEngine.executeTrade(request);
        } catch (MarketException e) {
            log.warn("Trade {} rejected on market {}: {} {}", request.getRequestId(), marketId, e.getKind(), e.getMessage());
            result = queued.failed(e.getKind(), e.getMessage(), clock.millis());
        } catch (RuntimeException e) {
            log.error("Trade {} failed unexpectedly on market {}", request.getRequestId(), marketId, e);
            result = queued.failed(ErrorKind.INTERNAL, "Internal error: " + e.getMessage(), clock.millis());
        } finally {
            pending.decrementAndGet();
        }
        resultStore.update(result);
        return result;
    }

    /**
     * Stop accepting work and wait for queued trades to drain.
     */
    public void shutdown(Duration timeout) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Executor for market {} did not drain in {}; {} trades abandoned",
                        marketId, timeout, executor.shutdownNow().size());
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
