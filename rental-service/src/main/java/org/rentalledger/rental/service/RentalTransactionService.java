package org.rentalledger.rental.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.rentalledger.common.dto.request.CreateRentalRequest;
import org.rentalledger.common.dto.request.RentalFilter;
import org.rentalledger.common.dto.request.RentalLineRequest;
import org.rentalledger.common.dto.response.RentalTransactionView;
import org.rentalledger.common.exception.InsufficientStockException;
import org.rentalledger.common.exception.ResourceNotFoundException;
import org.rentalledger.common.tx.AtomicUnit;
import org.rentalledger.common.util.IdGenerator;
import org.rentalledger.inventory.entity.Product;
import org.rentalledger.inventory.service.StockLedgerService;
import org.rentalledger.rental.entity.RentalTransaction;
import org.rentalledger.rental.entity.TransactionLine;
import org.rentalledger.rental.repository.RentalTransactionRepository;
import org.rentalledger.rental.repository.RentalTransactionSpecifications;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.rentalledger.common.util.RequestValidation.requireMaxLength;
import static org.rentalledger.common.util.RequestValidation.requireNonNull;
import static org.rentalledger.common.util.RequestValidation.requireNotEmpty;
import static org.rentalledger.common.util.RequestValidation.requirePositive;
import static org.rentalledger.common.util.RequestValidation.requireText;

@Service
@RequiredArgsConstructor
@Slf4j
public class RentalTransactionService {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("withdrawnAt"), Sort.Order.asc("transactionId"));

    private final RentalTransactionRepository rentalTransactionRepository;
    private final StockLedgerService stockLedgerService;
    private final AtomicUnit atomicUnit;
    private final RentalTransactionMapper mapper;
    private final Clock clock;

    /**
     * Create a rental transaction and reserve stock for every line. Either the transaction, its
     * lines and every stock decrement are committed together, or nothing is.
     */
    public RentalTransactionView createTransaction(CreateRentalRequest request) {
        validate(request);
        Map<String, Long> requestedByProduct = totalsByProduct(request.getLines());

        return atomicUnit.execute(() -> {
            String transactionId = IdGenerator.generateTransactionId();
            log.info("Creating rental transaction: transactionId={}, customerId={}, lines={}",
                    transactionId, request.getCustomerId(), request.getLines().size());

            Map<String, Product> products = stockLedgerService.lockProducts(requestedByProduct.keySet());

            // Check every product before the first decrement so a short product fails the whole request.
            requestedByProduct.forEach((productId, requested) -> {
                Product product = products.get(productId);
                if (!product.canReserve(requested)) {
                    log.warn("Insufficient stock for rental: transactionId={}, productId={}, available={}, requested={}",
                            transactionId, productId, product.getStockOnHand(), requested);
                    throw new InsufficientStockException(productId, product.getStockOnHand(), requested);
                }
            });

            RentalTransaction transaction = new RentalTransaction(transactionId, request.getCustomerId(),
                    request.getOperatorId(), LocalDateTime.now(clock), request.getDueAt(), request.getNotes());

            List<RentalLineRequest> lines = request.getLines();
            for (int i = 0; i < lines.size(); i++) {
                RentalLineRequest lineRequest = lines.get(i);
                Product product = products.get(lineRequest.getProductId());
                transaction.addLine(new TransactionLine(
                        IdGenerator.generateLineId(),
                        i + 1,
                        product.getProductId(),
                        lineRequest.getQuantity(),
                        lineRequest.getPriceOrDefault().resolve(product.getUnitPrice())));
                stockLedgerService.reserve(product.getProductId(), lineRequest.getQuantity(),
                        transactionId, request.getOperatorId());
            }
            transaction.recomputeAmountOwed();

            RentalTransaction saved = rentalTransactionRepository.save(transaction);
            log.info("Rental transaction created: transactionId={}, status={}, amountOwed={}",
                    saved.getTransactionId(), saved.getStatus(), saved.getAmountOwed());
            return mapper.toView(saved);
        });
    }

    /**
     * Close a transaction as it stands. Anything not returned stays billed.
     */
    public RentalTransactionView completeTransaction(String transactionId) {
        requireText(transactionId, "transactionId");

        return atomicUnit.execute(() -> {
            RentalTransaction transaction = rentalTransactionRepository.findByIdWithLock(transactionId)
                    .orElseThrow(() -> ResourceNotFoundException.transaction(transactionId));

            transaction.complete(LocalDateTime.now(clock));
            transaction.recomputeAmountOwed();
            RentalTransaction saved = rentalTransactionRepository.save(transaction);

            log.info("Rental transaction completed: transactionId={}, amountOwed={}",
                    transactionId, saved.getAmountOwed());
            return mapper.toView(saved);
        });
    }

    public RentalTransactionView getTransaction(String transactionId) {
        requireText(transactionId, "transactionId");
        return atomicUnit.read(() -> rentalTransactionRepository.findWithLinesById(transactionId)
                .map(mapper::toView)
                .orElseThrow(() -> ResourceNotFoundException.transaction(transactionId)));
    }

    public List<RentalTransactionView> listTransactions(RentalFilter filter) {
        RentalFilter criteria = filter != null ? filter : RentalFilter.all();
        LocalDateTime now = LocalDateTime.now(clock);
        return atomicUnit.read(() -> rentalTransactionRepository
                .findAll(RentalTransactionSpecifications.matching(criteria, now), NEWEST_FIRST)
                .stream()
                .map(mapper::toView)
                .toList());
    }

    private void validate(CreateRentalRequest request) {
        requireNonNull(request, "request");
        requireText(request.getCustomerId(), "customerId");
        requireText(request.getOperatorId(), "operatorId");
        requireNonNull(request.getDueAt(), "dueAt");
        requireMaxLength(request.getNotes(), RentalTransaction.MAX_NOTES_LENGTH, "notes");
        requireNotEmpty(request.getLines(), "lines");
        for (RentalLineRequest line : request.getLines()) {
            requireNonNull(line, "lines");
            requireText(line.getProductId(), "productId");
            requirePositive(line.getQuantity(), "quantity");
        }
    }

    // Summed as long so repeated lines for one product cannot wrap past Integer.MAX_VALUE.
    private Map<String, Long> totalsByProduct(List<RentalLineRequest> lines) {
        Map<String, Long> totals = new LinkedHashMap<>();
        for (RentalLineRequest line : lines) {
            totals.merge(line.getProductId(), (long) line.getQuantity(), Long::sum);
        }
        return totals;
    }
}
