package com.prediction.market.lmsr_engine.ratelimit;

import com.prediction.market.lmsr_engine.exception.ErrorKind;
import com.prediction.market.lmsr_engine.exception.MarketException;

/**
 * Thrown when a wallet submits trade intents faster than its admission limit.
 */
public class RateLimitExceededException extends MarketException {

    private final String identifier;
    private final long retryAfterMillis;

    public RateLimitExceededException(String identifier, long retryAfterMillis) {
        super(ErrorKind.RATE_LIMITED,
            String.format("Rate limit exceeded for %s. Retry after %d ms.", identifier, retryAfterMillis));
        this.identifier = identifier;
        this.retryAfterMillis = retryAfterMillis;
    }

    public String getIdentifier() {
        return identifier;
    }

    public long getRetryAfterMillis() {
        return retryAfterMillis;
    }
}
