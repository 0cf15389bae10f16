package org.rentalledger.common.exception;

import lombok.Getter;
import org.rentalledger.common.enums.RentalStatus;

/**
 * Thrown when the current status of a transaction forbids the requested operation.
 */
@Getter
public class InvalidStateException extends RentalException {

    private final RentalStatus status;

    public InvalidStateException(String transactionId, RentalStatus status, String operation) {
        super(ErrorKind.INVALID_STATE, transactionId,
                String.format("Cannot %s rental transaction %s in status %s", operation, transactionId, status));
        this.status = status;
    }
}
