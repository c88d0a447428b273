package com.salesinsight.domain.model;

import com.salesinsight.domain.exception.InvalidQueryException;

import java.util.Locale;

/**
 * What an uploaded file contains.
 */
public enum ImportEntityType {
    SALES,
    CUSTOMERS,
    PRODUCTS;

    public static ImportEntityType parse(String value) {
        if (value == null || value.isBlank()) {
            return SALES;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidQueryException("Unsupported entity type: " + value);
        }
    }
}
