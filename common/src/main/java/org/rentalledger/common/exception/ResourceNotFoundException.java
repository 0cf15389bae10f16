package org.rentalledger.common.exception;

/**
 * Thrown when a referenced transaction, line or product does not exist.
 */
public class ResourceNotFoundException extends RentalException {

    public ResourceNotFoundException(String id, String message) {
        super(ErrorKind.NOT_FOUND, id, message);
    }

    public static ResourceNotFoundException product(String productId) {
        return new ResourceNotFoundException(productId, "Product not found: " + productId);
    }

    public static ResourceNotFoundException transaction(String transactionId) {
        return new ResourceNotFoundException(transactionId, "Rental transaction not found: " + transactionId);
    }

    public static ResourceNotFoundException line(String lineId, String transactionId) {
        return new ResourceNotFoundException(lineId,
                "Line " + lineId + " not found in rental transaction " + transactionId);
    }
}
