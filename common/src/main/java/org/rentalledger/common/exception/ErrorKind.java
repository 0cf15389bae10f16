package org.rentalledger.common.exception;

/**
 * Failure kinds surfaced to callers of the rental operations.
 */
public enum ErrorKind {
    VALIDATION,
    NOT_FOUND,
    INSUFFICIENT_STOCK,
    EXCEEDS_AVAILABLE,
    INVALID_STATE,
    CONFLICT;

    /**
     * Only contention failures may be retried as-is; everything else needs a corrected request.
     */
    public boolean isRetryable() {
        return this == CONFLICT;
    }
}
