package com.prediction.market.lmsr_engine.model;

import java.math.BigDecimal;
import java.util.List;

import com.prediction.market.lmsr_engine.entity.Side;

/**
 * Aggregate of a resolution or payout retry run.
 *
 * @param payoutsDistributed true when every bet in the run was settled
 * @param totalPayout        sum of net credits actually paid
 * @param winnersCount       distinct wallets paid
 */
public record ResolutionSummary(
    String marketId,
    Side outcome,
    boolean payoutsDistributed,
    BigDecimal totalPayout,
    BigDecimal totalFees,
    int winnersCount,
    int winningBets,
    int losingBets,
    List<PayoutFailure> failures
) {
}
