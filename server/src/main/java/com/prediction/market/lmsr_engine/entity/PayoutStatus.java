package com.prediction.market.lmsr_engine.entity;

/**
 * Settlement progress of a single bet during resolution. Each bet is credited
 * independently so one failure never blocks the other winners.
 */
public enum PayoutStatus {
    NONE,
    CREDITED,
    FAILED
}
