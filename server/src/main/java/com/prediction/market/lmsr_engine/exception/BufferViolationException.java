package com.prediction.market.lmsr_engine.exception;

/**
 * Mutation would push market exposure below the buffer floor.
 */
public class BufferViolationException extends MarketException {

    public BufferViolationException(String message) {
        super(ErrorKind.BUFFER_VIOLATION, message);
    }
}
