package com.prediction.market.lmsr_engine.model;

import com.prediction.market.lmsr_engine.entity.Side;

/**
 * Non-binding quote against the current state. {@code pendingTrades} is the
 * number of intents already queued on the market; any of them may move the
 * price before this trade runs.
 */
public record TradePreview(
    String marketId,
    Side side,
    double amount,
    double shares,
    double averagePrice,
    PriceQuote pricesBefore,
    PriceQuote pricesAfter,
    int pendingTrades
) {
}
