package com.prediction.market.lmsr_engine.exception;

/**
 * Sell request exceeds the caller's open shares.
 */
public class InsufficientSharesException extends MarketException {

    public InsufficientSharesException(String message) {
        super(ErrorKind.INSUFFICIENT_SHARES, message);
    }
}
