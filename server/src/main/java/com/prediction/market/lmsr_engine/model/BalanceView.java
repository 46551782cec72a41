package com.prediction.market.lmsr_engine.model;

import java.math.BigDecimal;

/**
 * @param newUser true only on the call that provisioned the wallet
 */
public record BalanceView(String wallet, BigDecimal balance, boolean newUser) {
}
