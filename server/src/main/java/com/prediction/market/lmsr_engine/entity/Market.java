package com.prediction.market.lmsr_engine.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A binary question users trade on. Pricing state lives in {@link MarketState}.
 */
@Document(collection = "markets")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class Market {

    @Id
    private String id;

    private String question;
    private String description;
    private String category;
    private String createdBy;

    /**
     * Trading end time (epoch millis), informational. Trading stops at resolution.
     */
    private Long endTime;

    @Indexed
    @Builder.Default
    private MarketStatus status = MarketStatus.OPEN;

    /**
     * Winning side, null until resolved.
     */
    private Side resolution;

    private long createdAt;
    private Long resolvedAt;

    public boolean isOpen() {
        return status == MarketStatus.OPEN;
    }

    /**
     * Move to RESOLVED with the given outcome.
     *
     * @throws IllegalStateException if the market is already resolved
     */
    public void resolve(Side outcome, long timestamp) {
        if (!status.canTransitionTo(MarketStatus.RESOLVED)) {
            throw new IllegalStateException(
                String.format("Invalid market state transition: %s → RESOLVED (marketId=%s)", status, id));
        }
        this.status = MarketStatus.RESOLVED;
        this.resolution = outcome;
        this.resolvedAt = timestamp;
    }
}
