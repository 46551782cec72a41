package com.prediction.market.lmsr_engine.entity;

import com.prediction.market.lmsr_engine.exception.ValidationException;

/**
 * The two outcomes of a binary market.
 */
public enum Side {
    YES,
    NO;

    public Side opposite() {
        return this == YES ? NO : YES;
    }

    /**
     * Parse a user supplied side, case-insensitive and trimmed.
     *
     * @throws ValidationException if the value is not YES or NO
     */
    public static Side parse(String value) {
        if (value == null) {
            throw new ValidationException("Side must be YES or NO");
        }
        String normalized = value.trim().toUpperCase();
        if (normalized.equals("YES")) {
            return YES;
        }
        if (normalized.equals("NO")) {
            return NO;
        }
        throw new ValidationException("Side must be YES or NO");
    }
}
