package org.rentalledger.common.enums;

public enum MovementType {
    RENTAL_WITHDRAWAL,
    RENTAL_RETURN,
    RENTAL_CANCELLATION
}
