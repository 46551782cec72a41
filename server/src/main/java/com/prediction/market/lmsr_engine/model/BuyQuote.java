package com.prediction.market.lmsr_engine.model;

import com.prediction.market.lmsr_engine.entity.Side;

/**
 * Result of pricing a buy.
 *
 * @param newExposure exposure of {@code side} after the buy
 * @param pricesAfter display prices after the buy
 */
public record BuyQuote(
    Side side,
    double amount,
    double shares,
    double averagePrice,
    double newExposure,
    PriceQuote pricesAfter
) {
}
