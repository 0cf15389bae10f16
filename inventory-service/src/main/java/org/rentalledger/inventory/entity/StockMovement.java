package org.rentalledger.inventory.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.rentalledger.common.enums.MovementType;

import java.time.LocalDateTime;

/**
 * One immutable entry of the stock audit trail. Quantity is signed: negative when goods leave
 * inventory, positive when they come back.
 */
@Entity
@Table(name = "stock_movements", indexes = {
        @Index(name = "idx_stock_movements_reference", columnList = "reference"),
        @Index(name = "idx_stock_movements_product", columnList = "product_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StockMovement {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "product_id", nullable = false)
    private String productId;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 30)
    private MovementType type;

    @Column(name = "reference")
    private String reference;

    @Column(name = "operator_id")
    private String operatorId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public StockMovement(String productId, Integer quantity, MovementType type, String reference, String operatorId) {
        this.productId = productId;
        this.quantity = quantity;
        this.type = type;
        this.reference = reference;
        this.operatorId = operatorId;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
