package com.prediction.market.lmsr_engine.exception;

/**
 * Malformed trade input: side, amount, shares or wallet.
 */
public class ValidationException extends MarketException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION_ERROR, message);
    }
}
