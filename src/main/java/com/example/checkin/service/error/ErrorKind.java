package com.example.checkin.service.error;

/**
 * Outcome classes reported by the check-in engine. Only TRANSIENT may be retried with the same inputs.
 */
public enum ErrorKind {
    NOT_FOUND,
    CONFLICT,
    EXPIRED,
    VALIDATION_FAILED,
    OUT_OF_RANGE,
    TRANSIENT;

    public boolean isRetryable() {
        return this == TRANSIENT;
    }
}
