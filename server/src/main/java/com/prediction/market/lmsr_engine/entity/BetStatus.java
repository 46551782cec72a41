package com.prediction.market.lmsr_engine.entity;

/**
 * Bet state machine.
 *
 * OPEN → CLOSED   (all shares sold back to the market)
 * OPEN → RESOLVED (market resolved while the bet still held shares)
 * OPEN → VOID     (buy undone by its owner)
 *
 * Terminal states: CLOSED, RESOLVED, VOID
 */
public enum BetStatus {

    /**
     * Holding shares, eligible for sell, undo and payout.
     */
    OPEN,

    /**
     * Every share was sold back before resolution.
     */
    CLOSED,

    /**
     * Settled by market resolution. Payout may still be retried if it failed.
     */
    RESOLVED,

    /**
     * Compensated by an undo: market exposure reversed and amount refunded.
     */
    VOID;

    public boolean isTerminal() {
        return this != OPEN;
    }

    public boolean canTransitionTo(BetStatus to) {
        if (this.isTerminal()) {
            return false;
        }
        return to == CLOSED || to == RESOLVED || to == VOID;
    }
}
