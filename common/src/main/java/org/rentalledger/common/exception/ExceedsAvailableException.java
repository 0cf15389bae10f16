package org.rentalledger.common.exception;

import lombok.Getter;

/**
 * Thrown when a return asks to give back more units than are still outstanding on a line.
 */
@Getter
public class ExceedsAvailableException extends RentalException {

    private final String lineId;
    private final int pending;
    private final long requested;

    public ExceedsAvailableException(String lineId, int pending, long requested) {
        super(ErrorKind.EXCEEDS_AVAILABLE, lineId,
                String.format("Return quantity exceeds pending quantity on line %s: pending=%d, requested=%d",
                        lineId, pending, requested));
        this.lineId = lineId;
        this.pending = pending;
        this.requested = requested;
    }
}
