package com.prediction.market.lmsr_engine.entity;

public enum LedgerEntryType {
    STARTING_CREDIT,
    BUY,
    SELL,
    SELL_REVERSAL,
    UNDO_REFUND,
    PAYOUT,
    ADMIN_CREDIT
}
