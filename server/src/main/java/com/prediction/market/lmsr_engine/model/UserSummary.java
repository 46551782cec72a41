package com.prediction.market.lmsr_engine.model;

import java.math.BigDecimal;

/**
 * Admin view of a wallet with its betting activity. Undone bets are not counted.
 */
public record UserSummary(
    String wallet,
    BigDecimal balance,
    String authStatus,
    int totalBets,
    BigDecimal totalStaked,
    int openPositions,
    long createdAt,
    long lastSeenAt
) {
}
