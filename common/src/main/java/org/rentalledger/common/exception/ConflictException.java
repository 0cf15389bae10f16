package org.rentalledger.common.exception;

/**
 * The atomic unit could not commit because of a concurrent writer or a lock/transaction timeout.
 * Nothing was applied; the caller may retry.
 */
public class ConflictException extends RentalException {

    public ConflictException(String message, Throwable cause) {
        super(ErrorKind.CONFLICT, null, message, cause);
    }
}
