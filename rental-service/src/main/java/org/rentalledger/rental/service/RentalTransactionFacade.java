package org.rentalledger.rental.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.rentalledger.common.dto.request.CreateRentalRequest;
import org.rentalledger.common.dto.request.ProcessReturnRequest;
import org.rentalledger.common.dto.request.RentalFilter;
import org.rentalledger.common.dto.response.RentalTransactionView;
import org.rentalledger.common.exception.RentalException;
import org.rentalledger.common.result.OperationResult;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.function.Supplier;

/**
 * Entry points of the rental engine. Every call returns an {@link OperationResult}; failures of
 * the rental error taxonomy never escape as exceptions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RentalTransactionFacade {

    private final RentalTransactionService rentalTransactionService;
    private final ReturnService returnService;
    private final CancellationService cancellationService;
    private final OverdueSweepService overdueSweepService;

    public OperationResult<RentalTransactionView> createTransaction(CreateRentalRequest request) {
        return run("createTransaction", () -> rentalTransactionService.createTransaction(request));
    }

    public OperationResult<RentalTransactionView> processReturn(ProcessReturnRequest request) {
        return run("processReturn", () -> returnService.processReturn(request));
    }

    public OperationResult<RentalTransactionView> completeTransaction(String transactionId) {
        return run("completeTransaction", () -> rentalTransactionService.completeTransaction(transactionId));
    }

    public OperationResult<RentalTransactionView> cancelTransaction(String transactionId) {
        return run("cancelTransaction", () -> cancellationService.cancelTransaction(transactionId));
    }

    public OperationResult<Integer> sweepOverdue(LocalDateTime now) {
        return run("sweepOverdue", () -> overdueSweepService.sweepOverdue(now));
    }

    public OperationResult<RentalTransactionView> getTransaction(String transactionId) {
        return run("getTransaction", () -> rentalTransactionService.getTransaction(transactionId));
    }

    public OperationResult<List<RentalTransactionView>> listTransactions(RentalFilter filter) {
        return run("listTransactions", () -> rentalTransactionService.listTransactions(filter));
    }

    private <T> OperationResult<T> run(String operation, Supplier<T> work) {
        try {
            return OperationResult.success(work.get());
        } catch (RentalException ex) {
            log.warn("Rental operation rejected: operation={}, kind={}, entityRef={}, reason={}",
                    operation, ex.getKind(), ex.getEntityRef(), ex.getMessage());
            return OperationResult.failure(ex);
        }
    }
}
