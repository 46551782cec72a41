package com.prediction.market.lmsr_engine.entity;

/**
 * Market lifecycle. OPEN → RESOLVED exactly once; RESOLVED is terminal.
 */
public enum MarketStatus {
    OPEN,
    RESOLVED;

    public boolean isTerminal() {
        return this == RESOLVED;
    }

    public boolean canTransitionTo(MarketStatus to) {
        return this == OPEN && to == RESOLVED;
    }
}
