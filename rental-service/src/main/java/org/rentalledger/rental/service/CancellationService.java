package org.rentalledger.rental.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.rentalledger.common.dto.response.RentalTransactionView;
import org.rentalledger.common.enums.MovementType;
import org.rentalledger.common.exception.ResourceNotFoundException;
import org.rentalledger.common.tx.AtomicUnit;
import org.rentalledger.inventory.service.StockLedgerService;
import org.rentalledger.rental.entity.RentalTransaction;
import org.rentalledger.rental.entity.TransactionLine;
import org.rentalledger.rental.repository.RentalTransactionRepository;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

import static org.rentalledger.common.util.RequestValidation.requireText;

@Service
@RequiredArgsConstructor
@Slf4j
public class CancellationService {

    private final RentalTransactionRepository rentalTransactionRepository;
    private final StockLedgerService stockLedgerService;
    private final AtomicUnit atomicUnit;
    private final RentalTransactionMapper mapper;
    private final Clock clock;

    /**
     * Cancel an open transaction: put every outstanding unit back on hand and clear the amount owed.
     * Cancelling twice fails, the second call sees a terminal status.
     */
    public RentalTransactionView cancelTransaction(String transactionId) {
        requireText(transactionId, "transactionId");

        return atomicUnit.execute(() -> {
            log.info("Cancelling rental transaction: transactionId={}", transactionId);

            RentalTransaction transaction = rentalTransactionRepository.findByIdWithLock(transactionId)
                    .orElseThrow(() -> ResourceNotFoundException.transaction(transactionId));
            transaction.requireOpen("cancel");
            stockLedgerService.lockProducts(transaction.getLines().stream()
                    .filter(line -> line.outstandingQuantity() > 0)
                    .map(TransactionLine::getProductId)
                    .toList());

            for (TransactionLine line : transaction.getLines()) {
                int outstanding = line.markFullyReturned();
                if (outstanding > 0) {
                    stockLedgerService.credit(line.getProductId(), outstanding, MovementType.RENTAL_CANCELLATION,
                            transactionId, null);
                }
            }
            transaction.cancel(LocalDateTime.now(clock));

            RentalTransaction saved = rentalTransactionRepository.save(transaction);
            log.info("Rental transaction cancelled: transactionId={}, lines={}", transactionId, saved.getLines().size());
            return mapper.toView(saved);
        });
    }
}
