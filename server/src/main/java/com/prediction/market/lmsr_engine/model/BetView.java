package com.prediction.market.lmsr_engine.model;

import java.math.BigDecimal;

import com.prediction.market.lmsr_engine.entity.Bet;
import com.prediction.market.lmsr_engine.entity.BetResult;
import com.prediction.market.lmsr_engine.entity.BetStatus;
import com.prediction.market.lmsr_engine.entity.PayoutStatus;
import com.prediction.market.lmsr_engine.entity.Side;

/**
 * Read model of a bet. Current price, value and unrealized profit are only
 * set for open bets.
 */
public record BetView(
    String betId,
    String marketId,
    String question,
    Side side,
    BigDecimal amount,
    double shares,
    double averagePrice,
    BetStatus status,
    BetResult result,
    BigDecimal payout,
    BigDecimal profit,
    PayoutStatus payoutStatus,
    Double currentPrice,
    Double currentValue,
    Double unrealizedProfit,
    long createdAt
) {

    public static BetView settled(Bet bet, String question) {
        return new BetView(bet.getId(), bet.getMarketId(), question, bet.getSide(), bet.getAmount(),
            bet.getShares(), bet.getAveragePrice(), bet.getStatus(), bet.getResult(), bet.getPayout(),
            bet.getProfit(), bet.getPayoutStatus(), null, null, null, bet.getCreatedAt());
    }

    public static BetView open(Bet bet, String question, double currentPrice) {
        double value = bet.getShares() * currentPrice;
        double unrealized = value - bet.amount().toDouble();
        return new BetView(bet.getId(), bet.getMarketId(), question, bet.getSide(), bet.getAmount(),
            bet.getShares(), bet.getAveragePrice(), bet.getStatus(), bet.getResult(), null, null,
            bet.getPayoutStatus(), currentPrice, value, unrealized, bet.getCreatedAt());
    }
}
