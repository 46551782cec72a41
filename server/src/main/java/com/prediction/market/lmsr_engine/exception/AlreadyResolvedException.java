package com.prediction.market.lmsr_engine.exception;

public class AlreadyResolvedException extends MarketException {

    public AlreadyResolvedException(String message) {
        super(ErrorKind.ALREADY_RESOLVED, message);
    }
}
