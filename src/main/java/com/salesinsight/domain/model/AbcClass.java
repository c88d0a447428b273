package com.salesinsight.domain.model;

/**
 * Revenue contribution class. Thresholds apply to the cumulative share
 * including the product itself.
 */
public enum AbcClass {
    A,
    B,
    C
}
