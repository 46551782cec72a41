package com.prediction.market.lmsr_engine.model;

import com.prediction.market.lmsr_engine.entity.Side;

public record PriceQuote(double yesPrice, double noPrice) {

    public double priceOf(Side side) {
        return side == Side.YES ? yesPrice : noPrice;
    }
}
