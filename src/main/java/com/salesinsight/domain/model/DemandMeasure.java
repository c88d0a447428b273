package com.salesinsight.domain.model;

import com.salesinsight.domain.exception.InvalidQueryException;

import java.util.Locale;

/**
 * What the XYZ demand series counts per period.
 */
public enum DemandMeasure {
    QUANTITY,
    REVENUE;

    public static DemandMeasure parse(String value) {
        if (value == null || value.isBlank()) {
            return QUANTITY;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidQueryException("Unsupported demand measure: " + value);
        }
    }
}
