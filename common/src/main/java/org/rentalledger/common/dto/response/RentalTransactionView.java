package org.rentalledger.common.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.rentalledger.common.enums.RentalStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Detached snapshot of a rental transaction and its lines, safe to hand outside the atomic unit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RentalTransactionView {
    private String transactionId;
    private String customerId;
    private String operatorId;
    private LocalDateTime withdrawnAt;
    private LocalDateTime dueAt;
    private RentalStatus status;
    private BigDecimal amountOwed;
    private String notes;
    private LocalDateTime completedAt;
    private LocalDateTime cancelledAt;
    private Long version;
    private List<TransactionLineView> lines;

    public TransactionLineView lineFor(String productId) {
        return lines.stream()
                .filter(line -> line.getProductId().equals(productId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No line for product " + productId));
    }
}
