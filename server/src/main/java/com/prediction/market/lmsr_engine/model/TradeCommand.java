package com.prediction.market.lmsr_engine.model;

import java.math.BigDecimal;

import com.prediction.market.lmsr_engine.entity.TradeKind;

/**
 * Raw trade intent as received from the outer layer, before validation.
 * Side is kept as text so malformed values can be reported as validation errors.
 */
public record TradeCommand(
    TradeKind kind,
    String wallet,
    String marketId,
    String side,
    BigDecimal amount,
    Double shares,
    String betId
) {

    public static TradeCommand buy(String wallet, String marketId, String side, BigDecimal amount) {
        return new TradeCommand(TradeKind.BUY, wallet, marketId, side, amount, null, null);
    }

    public static TradeCommand sell(String wallet, String marketId, String side, double shares) {
        return new TradeCommand(TradeKind.SELL, wallet, marketId, side, null, shares, null);
    }

    public static TradeCommand sellFromBet(String wallet, String marketId, String betId, double shares) {
        return new TradeCommand(TradeKind.SELL, wallet, marketId, null, null, shares, betId);
    }

    public static TradeCommand undo(String wallet, String marketId, String betId) {
        return new TradeCommand(TradeKind.UNDO, wallet, marketId, null, null, null, betId);
    }
}
