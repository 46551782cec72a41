package com.prediction.market.lmsr_engine.exception;

/**
 * Base class for every failure the engine reports to callers. Each subclass
 * maps to one {@link ErrorKind}.
 */
public abstract class MarketException extends RuntimeException {

    private final ErrorKind kind;

    protected MarketException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
