package com.prediction.market.lmsr_engine.exception;

/**
 * The trade result existed but its retention window has passed.
 */
public class StaleRequestException extends MarketException {

    public StaleRequestException(String message) {
        super(ErrorKind.STALE_REQUEST, message);
    }
}
