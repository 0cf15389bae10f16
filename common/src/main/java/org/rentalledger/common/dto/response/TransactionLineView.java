package org.rentalledger.common.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionLineView {
    private String lineId;
    private int lineNumber;
    private String productId;
    private int quantityWithdrawn;
    private int quantityReturned;
    private int outstandingQuantity;
    private BigDecimal unitPriceAtWithdrawal;
}
