package com.prediction.market.lmsr_engine.ratelimit;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.prediction.market.lmsr_engine.config.MarketProperties;

/**
 * Admission throttling for trade submission.
 *
 * Default: 10 submissions per wallet per second; a producer waits up to 100ms
 * for a permit before being rejected. Both are set under {@code market.admission}.
 */
@Configuration
public class RateLimitConfig {

    @Bean
    public SubmissionRateLimiter submissionRateLimiter(MarketProperties properties) {
        MarketProperties.Admission admission = properties.getAdmission();
        return new SubmissionRateLimiter(admission.getSubmissionsPerSecond(), admission.getTimeout());
    }
}
