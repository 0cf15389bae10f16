package org.rentalledger.common.enums;

/**
 * Whether a product sitting exactly at its minimum stock counts as low.
 */
public enum LowStockBoundary {
    /** stockOnHand &lt;= minimumStock */
    INCLUSIVE,
    /** stockOnHand &lt; minimumStock */
    EXCLUSIVE
}
