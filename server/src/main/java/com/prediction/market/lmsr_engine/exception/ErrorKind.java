package com.prediction.market.lmsr_engine.exception;

/**
 * Stable error identifiers reported to callers.
 */
public enum ErrorKind {
    VALIDATION_ERROR,
    MARKET_CLOSED,
    INSUFFICIENT_FUNDS,
    INSUFFICIENT_SHARES,
    BUFFER_VIOLATION,
    ALREADY_RESOLVED,
    NOT_FOUND,
    STALE_REQUEST,
    UNDO_NOT_ALLOWED,
    RATE_LIMITED,
    INTERNAL
}
