package com.prediction.market.lmsr_engine.entity;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * A validated trade intent waiting in its market's queue. Consumed exactly once.
 */
@Getter
@AllArgsConstructor
@Builder(toBuilder = true)
public class TradeRequest {

    private final String requestId;
    private final TradeKind kind;
    private final String wallet;
    private final String marketId;
    private final Side side;

    /**
     * Currency to spend, BUY only.
     */
    private final BigDecimal amount;

    /**
     * Shares to liquidate, SELL only.
     */
    private final double shares;

    /**
     * Target bet: required for UNDO, optional for SELL.
     */
    private final String betId;

    private final int queuePosition;
    private final long submittedAt;
}
