package com.prediction.market.lmsr_engine.model;

import java.math.BigDecimal;

import com.prediction.market.lmsr_engine.entity.MarketStatus;
import com.prediction.market.lmsr_engine.entity.Side;

/**
 * Market listing row: metadata, live prices and aggregate volume per side.
 */
public record MarketSummary(
    String marketId,
    String question,
    String description,
    String category,
    Long endTime,
    MarketStatus status,
    Side resolution,
    PriceQuote prices,
    BigDecimal yesTotal,
    BigDecimal noTotal,
    int betCount,
    long createdAt
) {
}
