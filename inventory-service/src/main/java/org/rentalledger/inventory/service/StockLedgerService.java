package org.rentalledger.inventory.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.rentalledger.common.config.RentalProperties;
import org.rentalledger.common.enums.LowStockBoundary;
import org.rentalledger.common.enums.MovementType;
import org.rentalledger.common.exception.InsufficientStockException;
import org.rentalledger.common.exception.ResourceNotFoundException;
import org.rentalledger.common.exception.ValidationException;
import org.rentalledger.inventory.entity.Product;
import org.rentalledger.inventory.entity.StockMovement;
import org.rentalledger.inventory.repository.ProductRepository;
import org.rentalledger.inventory.repository.StockMovementRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Authoritative quantity-on-hand per product.
 * <p>
 * The mutating methods are {@link Propagation#MANDATORY}: they refuse to run unless the caller
 * already opened the atomic unit that also writes the rental transaction, so stock and
 * transaction rows always commit or roll back together.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StockLedgerService {

    private final ProductRepository productRepository;
    private final StockMovementRepository stockMovementRepository;
    private final RentalProperties rentalProperties;

    /**
     * Lock every requested product row, in ascending id order, and return them keyed by id.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Map<String, Product> lockProducts(Collection<String> productIds) {
        List<String> ordered = productIds.stream().distinct().sorted().toList();
        if (ordered.isEmpty()) {
            return Map.of();
        }

        Map<String, Product> locked = productRepository.findAllByProductIdInWithLock(ordered).stream()
                .collect(Collectors.toMap(Product::getProductId, Function.identity(),
                        (first, second) -> first, LinkedHashMap::new));

        for (String productId : ordered) {
            if (!locked.containsKey(productId)) {
                log.warn("Unknown product in reservation: productId={}", productId);
                throw ResourceNotFoundException.product(productId);
            }
        }
        return locked;
    }

    /**
     * Decrement stock for a withdrawal. Fails without touching anything when stock is short.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Product reserve(String productId, int quantity, String reference, String operatorId) {
        if (quantity <= 0) {
            throw new ValidationException("quantity", "Reserved quantity must be positive, got " + quantity);
        }
        log.info("Reserving stock: productId={}, quantity={}, reference={}", productId, quantity, reference);

        Product product = productRepository.findByProductIdWithLock(productId)
                .orElseThrow(() -> ResourceNotFoundException.product(productId));

        if (!product.canReserve(quantity)) {
            log.warn("Insufficient stock: productId={}, available={}, requested={}",
                    productId, product.getStockOnHand(), quantity);
            throw new InsufficientStockException(productId, product.getStockOnHand(), quantity);
        }

        product.reserve(quantity);
        productRepository.save(product);
        stockMovementRepository.save(
                new StockMovement(productId, -quantity, MovementType.RENTAL_WITHDRAWAL, reference, operatorId));

        log.info("Stock reserved: productId={}, quantity={}, remaining={}",
                productId, quantity, product.getStockOnHand());
        return product;
    }

    /**
     * Put goods back on hand after a return or a cancellation. A zero quantity is a no-op.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Product credit(String productId, int quantity, MovementType type, String reference, String operatorId) {
        if (quantity < 0) {
            throw new ValidationException("quantity", "Credited quantity must not be negative, got " + quantity);
        }

        Product product = productRepository.findByProductIdWithLock(productId)
                .orElseThrow(() -> ResourceNotFoundException.product(productId));
        if (quantity == 0) {
            return product;
        }

        product.credit(quantity);
        productRepository.save(product);
        stockMovementRepository.save(new StockMovement(productId, quantity, type, reference, operatorId));

        log.info("Stock credited: productId={}, quantity={}, type={}, reference={}, onHand={}",
                productId, quantity, type, reference, product.getStockOnHand());
        return product;
    }

    @Transactional(readOnly = true)
    public Product getProduct(String productId) {
        return productRepository.findById(productId)
                .orElseThrow(() -> ResourceNotFoundException.product(productId));
    }

    @Transactional(readOnly = true)
    public List<StockMovement> findMovements(String reference) {
        return stockMovementRepository.findByReferenceOrderByIdAsc(reference);
    }

    /**
     * Products at or under their minimum stock; whether "at" counts is
     * {@code rental.stock.low-stock-boundary}.
     */
    @Transactional(readOnly = true)
    public List<Product> findLowStockProducts() {
        LowStockBoundary boundary = rentalProperties.getStock().getLowStockBoundary();
        return boundary == LowStockBoundary.INCLUSIVE
                ? productRepository.findAtOrBelowMinimumStock()
                : productRepository.findBelowMinimumStock();
    }
}
