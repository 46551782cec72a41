package com.prediction.market.lmsr_engine.model;

import java.math.BigDecimal;
import java.util.List;

import com.prediction.market.lmsr_engine.entity.Side;

public record PayoutReport(
    String marketId,
    Side outcome,
    BigDecimal totalPayout,
    BigDecimal totalFees,
    List<WalletPayout> wallets
) {
}
