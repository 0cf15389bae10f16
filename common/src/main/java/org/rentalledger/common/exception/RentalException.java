package org.rentalledger.common.exception;

import lombok.Getter;

/**
 * Base of every business failure raised by the rental and stock services.
 * <p>
 * Carries the failure kind and a reference to the offending entity (product, line or
 * transaction id) so an operator can correct the request.
 */
@Getter
public abstract class RentalException extends RuntimeException {

    private final ErrorKind kind;
    private final String entityRef;

    protected RentalException(ErrorKind kind, String entityRef, String message) {
        super(message);
        this.kind = kind;
        this.entityRef = entityRef;
    }

    protected RentalException(ErrorKind kind, String entityRef, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.entityRef = entityRef;
    }
}
