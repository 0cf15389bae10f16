package org.rentalledger.common.result;

import lombok.Value;
import org.rentalledger.common.exception.ErrorKind;
import org.rentalledger.common.exception.RentalException;

@Value
public class OperationError {
    ErrorKind kind;
    String message;
    String entityRef;

    public static OperationError from(RentalException ex) {
        return new OperationError(ex.getKind(), ex.getMessage(), ex.getEntityRef());
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
