package com.prediction.market.lmsr_engine.execution;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

import org.springframework.scheduling.annotation.Scheduled;

import com.prediction.market.lmsr_engine.entity.TradeResult;
import com.prediction.market.lmsr_engine.exception.NotFoundException;
import com.prediction.market.lmsr_engine.exception.StaleRequestException;

import lombok.extern.slf4j.Slf4j;

/**
 * Trade results keyed by request id.
 *
 * Completed results are kept for {@code ttl} and at most {@code maxResults} of
 * them at once, oldest evicted first. Ids of dropped results are remembered for
 * a while so a late poll is told the result expired instead of that it never
 * existed. Expiry only forgets the result; the trade's effects stay.
 */
@Slf4j
public class TradeResultStore {

    private final ConcurrentHashMap<String, TradeResult> results = new ConcurrentHashMap<>();
    private final Queue<String> completionOrder = new ConcurrentLinkedQueue<>();
    private final Map<String, Boolean> expiredIds;

    private final Duration ttl;
    private final int maxResults;
    private final Clock clock;

    public TradeResultStore(Duration ttl, int maxResults, Clock clock) {
        this.ttl = ttl;
        this.maxResults = maxResults;
        this.clock = clock;
        int tombstoneLimit = Math.max(maxResults * 10, 1000);
        this.expiredIds = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > tombstoneLimit;
            }
        });
    }

    /**
     * Record a new QUEUED result.
     */
    public void register(TradeResult result) {
        results.put(result.getRequestId(), result);
    }

    /**
     * Replace the stored result. Completing a result may evict the oldest
     * completed ones beyond {@code maxResults}.
     */
    public void update(TradeResult result) {
        results.put(result.getRequestId(), result);
        if (result.isDone()) {
            completionOrder.add(result.getRequestId());
            evictOverflow();
        }
    }

    /**
     * Drop a result that was registered but never queued.
     */
    public void discard(String requestId) {
        results.remove(requestId);
    }

    /**
     * Current result for a request. Reading has no side effects; repeated
     * polls return the same value.
     *
     * @throws StaleRequestException if the result existed but has expired
     * @throws NotFoundException     if the id was never issued
     */
    public TradeResult get(String requestId) {
        TradeResult result = requestId == null ? null : results.get(requestId);
        if (result != null && isExpired(result, clock.millis())) {
            expire(requestId);
            result = null;
        }
        if (result != null) {
            return result;
        }
        if (requestId != null && expiredIds.containsKey(requestId)) {
            throw new StaleRequestException("Trade result expired: " + requestId);
        }
        throw new NotFoundException("Unknown trade request: " + requestId);
    }

    @Scheduled(fixedDelayString = "${market.result-purge-interval:PT1M}")
    public int purgeExpired() {
        long now = clock.millis();
        int purged = 0;
        for (TradeResult result : results.values()) {
            if (isExpired(result, now)) {
                expire(result.getRequestId());
                purged++;
            }
        }
        if (purged > 0) {
            log.info("Purged {} expired trade results ({} retained)", purged, results.size());
        }
        return purged;
    }

    public int size() {
        return results.size();
    }

    private boolean isExpired(TradeResult result, long now) {
        return result.isDone()
                && result.getCompletedAt() != null
                && now - result.getCompletedAt() > ttl.toMillis();
    }

    private void expire(String requestId) {
        if (results.remove(requestId) != null) {
            expiredIds.put(requestId, Boolean.TRUE);
        }
        completionOrder.remove(requestId);
    }

    private synchronized void evictOverflow() {
        while (completionOrder.size() > maxResults) {
            String oldest = completionOrder.poll();
            if (oldest == null) {
                return;
            }
            if (results.remove(oldest) != null) {
                expiredIds.put(oldest, Boolean.TRUE);
                log.debug("Evicted trade result {} (limit {})", oldest, maxResults);
            }
        }
    }
}
