package com.prediction.market.lmsr_engine.model;

import com.prediction.market.lmsr_engine.entity.MarketState;
import com.prediction.market.lmsr_engine.entity.Side;

/**
 * Consistent, immutable view of a market's exposure. Published after every
 * mutation so readers never need the market lock.
 */
public record MarketSnapshot(
    String marketId,
    double qYes,
    double qNo,
    double liquidityB,
    double bufferFloor,
    long sequence
) {

    public static MarketSnapshot of(MarketState state) {
        return new MarketSnapshot(state.getMarketId(), state.getQYes(), state.getQNo(),
            state.getLiquidityB(), state.getBufferFloor(), state.getSequence());
    }

    public double exposure(Side side) {
        return side == Side.YES ? qYes : qNo;
    }
}
