package com.prediction.market.lmsr_engine.exception;

import com.prediction.market.lmsr_engine.entity.Money;

/**
 * Debit exceeds the wallet balance. Carries both figures for the caller's message.
 */
public class InsufficientFundsException extends MarketException {

    private final Money available;
    private final Money required;

    public InsufficientFundsException(String wallet, Money available, Money required) {
        super(ErrorKind.INSUFFICIENT_FUNDS,
            String.format("Insufficient balance for %s: have %s, need %s", wallet, available, required));
        this.available = available;
        this.required = required;
    }

    public Money getAvailable() {
        return available;
    }

    public Money getRequired() {
        return required;
    }
}
