package com.salesinsight.domain.model;

import com.salesinsight.domain.exception.InvalidQueryException;

import java.util.Locale;

public enum TrendGranularity {
    DAY,
    WEEK,
    MONTH;

    public static TrendGranularity parse(String value, TrendGranularity fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidQueryException("Unsupported period: " + value + " (expected day, week or month)");
        }
    }
}
