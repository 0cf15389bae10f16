package org.rentalledger.inventory.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.rentalledger.common.exception.InsufficientStockException;
import org.rentalledger.common.exception.ValidationException;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "products")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Product {

    @Id
    private String productId;

    @Column(name = "sku", unique = true)
    private String sku;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "unit", length = 20)
    private String unit;

    @Column(name = "stock_on_hand", nullable = false)
    private Integer stockOnHand;

    @Column(name = "minimum_stock", nullable = false)
    private Integer minimumStock;

    @Column(name = "unit_price", nullable = false, precision = 19, scale = 2)
    private BigDecimal unitPrice;

    @Version
    private Long version;

    @Column(name = "last_updated")
    private LocalDateTime lastUpdated;

    @PrePersist
    @PreUpdate
    protected void onUpdate() {
        lastUpdated = LocalDateTime.now();
    }

    public boolean canReserve(long quantity) {
        return stockOnHand >= quantity;
    }

    public void reserve(int quantity) {
        if (!canReserve(quantity)) {
            throw new InsufficientStockException(productId, stockOnHand, quantity);
        }
        stockOnHand -= quantity;
    }

    public void credit(int quantity) {
        if (quantity < 0) {
            throw new ValidationException("quantity", "Cannot credit a negative quantity to product " + productId);
        }
        stockOnHand += quantity;
    }
}
