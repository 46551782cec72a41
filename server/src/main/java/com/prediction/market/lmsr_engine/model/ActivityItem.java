package com.prediction.market.lmsr_engine.model;

import java.math.BigDecimal;

import com.prediction.market.lmsr_engine.entity.Side;

/**
 * One bet in the recent-activity feed.
 *
 * @param currentProbability the market's YES price as a percentage, one decimal
 */
public record ActivityItem(
    String betId,
    String marketId,
    String question,
    Side side,
    BigDecimal amount,
    double shares,
    String wallet,
    double currentProbability,
    long createdAt
) {
}
