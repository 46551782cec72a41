package com.prediction.market.lmsr_engine.exception;

/**
 * Trade attempted against a resolved market.
 */
public class MarketClosedException extends MarketException {

    public MarketClosedException(String message) {
        super(ErrorKind.MARKET_CLOSED, message);
    }
}
