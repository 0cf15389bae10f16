package org.rentalledger.common.result;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import org.rentalledger.common.exception.RentalException;

/**
 * Outcome of a rental operation: a payload on success, a tagged {@link OperationError} otherwise.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class OperationResult<T> {

    private final T payload;
    private final OperationError error;

    public static <T> OperationResult<T> success(T payload) {
        return new OperationResult<>(payload, null);
    }

    public static <T> OperationResult<T> failure(OperationError error) {
        return new OperationResult<>(null, error);
    }

    public static <T> OperationResult<T> failure(RentalException ex) {
        return failure(OperationError.from(ex));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }
}
