package com.prediction.market.lmsr_engine.model;

import com.prediction.market.lmsr_engine.entity.Side;

public record SellPreview(
    String marketId,
    Side side,
    double shares,
    double proceeds,
    double averagePrice,
    PriceQuote pricesAfter,
    int pendingTrades
) {
}
