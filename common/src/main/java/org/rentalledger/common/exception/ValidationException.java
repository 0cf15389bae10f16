package org.rentalledger.common.exception;

/**
 * Thrown for malformed input, always before anything is mutated.
 */
public class ValidationException extends RentalException {

    public ValidationException(String field, String message) {
        super(ErrorKind.VALIDATION, field, message);
    }
}
