package com.salesinsight.domain.model;

import com.salesinsight.domain.exception.InvalidQueryException;

import java.math.BigDecimal;
import java.util.Locale;

public enum ComparisonMetric {
    REVENUE,
    QUANTITY,
    ORDERS,
    AVERAGE_CHECK;

    public BigDecimal extract(SalesTotals totals) {
        switch (this) {
            case REVENUE:
                return totals.getRevenue();
            case QUANTITY:
                return totals.getQuantity();
            case ORDERS:
                return BigDecimal.valueOf(totals.getOrders());
            case AVERAGE_CHECK:
                return totals.averageCheck();
            default:
                throw new IllegalStateException("Unknown metric: " + this);
        }
    }

    /**
     * Null or blank selects every metric.
     */
    public static ComparisonMetric parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidQueryException("Unsupported metric: " + value);
        }
    }
}
