package com.prediction.market.lmsr_engine.model;

import com.prediction.market.lmsr_engine.entity.Side;

/**
 * Result of pricing a sell.
 */
public record SellQuote(
    Side side,
    double shares,
    double proceeds,
    double averagePrice,
    double newExposure,
    PriceQuote pricesAfter
) {
}
