package com.prediction.market.lmsr_engine.model;

/**
 * Comparison of previewed and realized shares for a completed buy.
 *
 * @param relativeDifference (actual - expected) / expected
 * @param undoRecommended    |relativeDifference| exceeded the configured threshold
 */
public record SlippageReport(
    String requestId,
    String betId,
    double expectedShares,
    double actualShares,
    double relativeDifference,
    boolean undoRecommended
) {
}
