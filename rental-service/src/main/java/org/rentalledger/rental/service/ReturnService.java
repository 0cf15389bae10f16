package org.rentalledger.rental.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.rentalledger.common.config.RentalProperties;
import org.rentalledger.common.dto.request.ProcessReturnRequest;
import org.rentalledger.common.dto.request.ReturnLineRequest;
import org.rentalledger.common.dto.response.RentalTransactionView;
import org.rentalledger.common.enums.MovementType;
import org.rentalledger.common.exception.ExceedsAvailableException;
import org.rentalledger.common.exception.ResourceNotFoundException;
import org.rentalledger.common.tx.AtomicUnit;
import org.rentalledger.inventory.service.StockLedgerService;
import org.rentalledger.rental.entity.RentalTransaction;
import org.rentalledger.rental.entity.TransactionLine;
import org.rentalledger.rental.repository.RentalTransactionRepository;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.rentalledger.common.util.RequestValidation.requireMaxLength;
import static org.rentalledger.common.util.RequestValidation.requireNonNull;
import static org.rentalledger.common.util.RequestValidation.requireNotEmpty;
import static org.rentalledger.common.util.RequestValidation.requirePositive;
import static org.rentalledger.common.util.RequestValidation.requireText;

/**
 * Applies partial or full returns against an open rental transaction.
 * <p>
 * A batch is all-or-nothing: every line is resolved and checked against its pending quantity
 * before any line or stock row changes. The amount owed is then rebuilt from the whole line set.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReturnService {

    private final RentalTransactionRepository rentalTransactionRepository;
    private final StockLedgerService stockLedgerService;
    private final AtomicUnit atomicUnit;
    private final RentalTransactionMapper mapper;
    private final RentalProperties rentalProperties;
    private final Clock clock;

    public RentalTransactionView processReturn(ProcessReturnRequest request) {
        validate(request);
        Map<String, Long> requestedByLine = totalsByLine(request);

        return atomicUnit.execute(() -> {
            String transactionId = request.getTransactionId();
            log.info("Processing return: transactionId={}, lines={}", transactionId, requestedByLine.size());

            RentalTransaction transaction = rentalTransactionRepository.findByIdWithLock(transactionId)
                    .orElseThrow(() -> ResourceNotFoundException.transaction(transactionId));
            transaction.requireOpen("process return on");

            Map<TransactionLine, Integer> accepted = new LinkedHashMap<>();
            requestedByLine.forEach((lineId, quantity) -> {
                TransactionLine line = transaction.findLine(lineId)
                        .orElseThrow(() -> ResourceNotFoundException.line(lineId, transactionId));
                if (quantity > line.outstandingQuantity()) {
                    log.warn("Return exceeds pending quantity: transactionId={}, lineId={}, pending={}, requested={}",
                            transactionId, lineId, line.outstandingQuantity(), quantity);
                    throw new ExceedsAvailableException(lineId, line.outstandingQuantity(), quantity);
                }
                accepted.put(line, quantity.intValue());
            });
            transaction.appendNote(rentalProperties.getReturnNoteTag(), request.getNotes());

            // Product rows are locked in the same ascending id order createTransaction uses.
            stockLedgerService.lockProducts(accepted.keySet().stream().map(TransactionLine::getProductId).toList());
            accepted.forEach((line, quantity) -> {
                line.applyReturn(quantity);
                stockLedgerService.credit(line.getProductId(), quantity, MovementType.RENTAL_RETURN,
                        transactionId, request.getOperatorId());
            });

            transaction.recomputeAmountOwed();
            if (transaction.isFullyReturned()) {
                transaction.complete(LocalDateTime.now(clock));
                log.info("All goods returned, closing rental transaction: transactionId={}", transactionId);
            }

            RentalTransaction saved = rentalTransactionRepository.save(transaction);
            log.info("Return processed: transactionId={}, status={}, amountOwed={}",
                    transactionId, saved.getStatus(), saved.getAmountOwed());
            return mapper.toView(saved);
        });
    }

    private void validate(ProcessReturnRequest request) {
        requireNonNull(request, "request");
        requireText(request.getTransactionId(), "transactionId");
        requireText(request.getOperatorId(), "operatorId");
        requireMaxLength(request.getNotes(), RentalTransaction.MAX_NOTES_LENGTH, "notes");
        requireNotEmpty(request.getReturns(), "returns");
        for (ReturnLineRequest line : request.getReturns()) {
            requireNonNull(line, "returns");
            requireText(line.getLineId(), "lineId");
            requirePositive(line.getQuantity(), "quantity");
        }
    }

    // The same line named twice in one batch counts as one return of the combined quantity.
    private Map<String, Long> totalsByLine(ProcessReturnRequest request) {
        Map<String, Long> totals = new LinkedHashMap<>();
        for (ReturnLineRequest line : request.getReturns()) {
            totals.merge(line.getLineId(), (long) line.getQuantity(), Long::sum);
        }
        return totals;
    }
}
