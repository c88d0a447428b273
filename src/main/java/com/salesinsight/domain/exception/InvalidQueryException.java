package com.salesinsight.domain.exception;

/**
 * A request rejected before any computation: bad date range, negative limit,
 * unknown enum value.
 */
public class InvalidQueryException extends RuntimeException {

    public InvalidQueryException(String message) {
        super(message);
    }
}
