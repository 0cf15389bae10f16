package org.rentalledger.rental.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.rentalledger.common.exception.ExceedsAvailableException;
import org.rentalledger.common.exception.ValidationException;

import java.math.BigDecimal;

/**
 * One product entry of a rental transaction. The withdrawn quantity and the unit price are
 * fixed at creation; the returned quantity only grows and never passes the withdrawn one.
 */
@Entity
@Table(name = "transaction_lines")
@Getter
@Setter
@NoArgsConstructor
@ToString(exclude = "transaction")
public class TransactionLine {

    @Id
    private String lineId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "transaction_id", nullable = false)
    private RentalTransaction transaction;

    @Column(name = "line_number", nullable = false)
    private Integer lineNumber;

    @Column(name = "product_id", nullable = false)
    private String productId;

    @Column(name = "quantity_withdrawn", nullable = false, updatable = false)
    private Integer quantityWithdrawn;

    @Column(name = "quantity_returned", nullable = false)
    private Integer quantityReturned;

    @Column(name = "unit_price_at_withdrawal", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal unitPriceAtWithdrawal;

    public TransactionLine(String lineId, int lineNumber, String productId, int quantityWithdrawn,
                           BigDecimal unitPriceAtWithdrawal) {
        this.lineId = lineId;
        this.lineNumber = lineNumber;
        this.productId = productId;
        this.quantityWithdrawn = quantityWithdrawn;
        this.quantityReturned = 0;
        this.unitPriceAtWithdrawal = unitPriceAtWithdrawal;
    }

    public int outstandingQuantity() {
        return quantityWithdrawn - quantityReturned;
    }

    public boolean isFullyReturned() {
        return quantityReturned.equals(quantityWithdrawn);
    }

    public BigDecimal outstandingValue() {
        return unitPriceAtWithdrawal.multiply(BigDecimal.valueOf(outstandingQuantity()));
    }

    public void applyReturn(int quantity) {
        if (quantity <= 0) {
            throw new ValidationException("quantity", "Returned quantity must be positive, got " + quantity);
        }
        if (quantity > outstandingQuantity()) {
            throw new ExceedsAvailableException(lineId, outstandingQuantity(), quantity);
        }
        quantityReturned += quantity;
    }

    /**
     * Close the line out and report how many units were still outstanding.
     */
    public int markFullyReturned() {
        int outstanding = outstandingQuantity();
        quantityReturned = quantityWithdrawn;
        return outstanding;
    }
}
