package org.rentalledger.common.exception;

import lombok.Getter;

/**
 * Thrown when a reservation asks for more units than the product has on hand.
 */
@Getter
public class InsufficientStockException extends RentalException {

    private final String productId;
    private final int available;
    private final long requested;

    public InsufficientStockException(String productId, int available, long requested) {
        super(ErrorKind.INSUFFICIENT_STOCK, productId,
                String.format("Insufficient stock for product %s: available=%d, requested=%d",
                        productId, available, requested));
        this.productId = productId;
        this.available = available;
        this.requested = requested;
    }
}
