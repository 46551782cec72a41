package com.prediction.market.lmsr_engine.model;

import java.math.BigDecimal;
import java.util.List;

public record WalletPayout(
    String wallet,
    BigDecimal totalBet,
    double totalShares,
    BigDecimal grossPayout,
    BigDecimal fees,
    BigDecimal netCredit,
    List<BetView> bets
) {
}
