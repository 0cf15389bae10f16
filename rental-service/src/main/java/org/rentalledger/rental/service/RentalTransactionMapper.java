package org.rentalledger.rental.service;

import org.rentalledger.common.dto.response.RentalTransactionView;
import org.rentalledger.common.dto.response.TransactionLineView;
import org.rentalledger.rental.entity.RentalTransaction;
import org.rentalledger.rental.entity.TransactionLine;
import org.springframework.stereotype.Component;

/**
 * Copies entities into views while the atomic unit is still open, so lazy lines are loaded
 * before the persistence context goes away.
 */
@Component
public class RentalTransactionMapper {

    public RentalTransactionView toView(RentalTransaction transaction) {
        return RentalTransactionView.builder()
                .transactionId(transaction.getTransactionId())
                .customerId(transaction.getCustomerId())
                .operatorId(transaction.getOperatorId())
                .withdrawnAt(transaction.getWithdrawnAt())
                .dueAt(transaction.getDueAt())
                .status(transaction.getStatus())
                .amountOwed(transaction.getAmountOwed())
                .notes(transaction.getNotes())
                .completedAt(transaction.getCompletedAt())
                .cancelledAt(transaction.getCancelledAt())
                .version(transaction.getVersion())
                .lines(transaction.getLines().stream().map(this::toView).toList())
                .build();
    }

    public TransactionLineView toView(TransactionLine line) {
        return TransactionLineView.builder()
                .lineId(line.getLineId())
                .lineNumber(line.getLineNumber())
                .productId(line.getProductId())
                .quantityWithdrawn(line.getQuantityWithdrawn())
                .quantityReturned(line.getQuantityReturned())
                .outstandingQuantity(line.outstandingQuantity())
                .unitPriceAtWithdrawal(line.getUnitPriceAtWithdrawal())
                .build();
    }
}
