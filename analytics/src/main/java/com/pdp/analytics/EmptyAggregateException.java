package com.pdp.analytics;

/**
 * Raised when an aggregate over zero users is decrypted or read.
 */
public class EmptyAggregateException extends IllegalStateException {
    public EmptyAggregateException(String message) {
        super(message);
    }
}
