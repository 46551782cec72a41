package com.prediction.market.lmsr_engine.exception;

/**
 * Unknown market, bet or request id.
 */
public class NotFoundException extends MarketException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
