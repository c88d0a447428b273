package com.salesinsight.domain.model;

/**
 * Demand stability class by coefficient of variation:
 * X below 10 %, Y below 25 %, Z otherwise.
 */
public enum XyzClass {
    X,
    Y,
    Z
}
