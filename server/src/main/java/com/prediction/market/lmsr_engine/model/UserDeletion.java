package com.prediction.market.lmsr_engine.model;

public record UserDeletion(
    String wallet,
    int positionsSold,
    int failedSales,
    int betsRemoved
) {
}
