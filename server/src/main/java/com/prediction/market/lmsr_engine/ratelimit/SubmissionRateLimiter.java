package com.prediction.market.lmsr_engine.ratelimit;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.scheduling.annotation.Scheduled;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-wallet admission control in front of the trade queues. A producer that
 * cannot get a permit within the timeout is rejected instead of growing the
 * queue without bound.
 */
@Slf4j
public class SubmissionRateLimiter {

    private final Map<String, RateLimiter> cache = new ConcurrentHashMap<>();
    private final RateLimiterConfig config;

    public SubmissionRateLimiter(int submissionsPerSecond, Duration timeout) {
        this.config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(submissionsPerSecond)
                .timeoutDuration(timeout)
                .build();
    }

    /**
     * @throws RateLimitExceededException if no permit became available in time
     */
    public void acquire(String wallet) {
        RateLimiter rateLimiter = cache.computeIfAbsent(wallet, k -> RateLimiter.of("submit-" + k, config));
        if (!rateLimiter.acquirePermission()) {
            long retryAfter = config.getLimitRefreshPeriod().toMillis();
            log.warn("Submission rate limit exceeded for wallet {}", wallet);
            throw new RateLimitExceededException(wallet, retryAfter);
        }
    }

    /**
     * Forget limiters of wallets that have been quiet. Runs every 5 minutes.
     */
    @Scheduled(fixedRate = 300000) // 5 minutes
    public int cleanup() {
        int before = cache.size();
        cache.entrySet().removeIf(entry ->
                entry.getValue().getMetrics().getAvailablePermissions() >= config.getLimitForPeriod()
                        && entry.getValue().getMetrics().getNumberOfWaitingThreads() == 0);
        int removed = before - cache.size();
        log.debug("Removed {} idle submission limiters", removed);
        return removed;
    }
}
