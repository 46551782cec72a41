package com.prediction.market.lmsr_engine.model;

import java.math.BigDecimal;

/**
 * A bet whose payout credit failed and needs retry or manual remediation.
 */
public record PayoutFailure(String betId, String wallet, BigDecimal netCredit, String reason) {
}
