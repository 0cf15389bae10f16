package org.rentalledger.inventory.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
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

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StockLedgerServiceTest {

    @Mock
    private ProductRepository productRepository;

    @Mock
    private StockMovementRepository stockMovementRepository;

    @Spy
    private RentalProperties rentalProperties = new RentalProperties();

    @InjectMocks
    private StockLedgerService stockLedgerService;

    private Product drill;
    private Product mixer;

    @BeforeEach
    void setUp() {
        drill = product("PROD-001", 10);
        mixer = product("PROD-002", 2);
    }

    @Test
    void reserve_SufficientStock_DecrementsAndRecordsWithdrawal() {
        // Given
        when(productRepository.findByProductIdWithLock("PROD-001")).thenReturn(Optional.of(drill));

        // When
        Product reserved = stockLedgerService.reserve("PROD-001", 4, "rent-1", "operator-1");

        // Then
        assertThat(reserved.getStockOnHand()).isEqualTo(6);
        verify(productRepository).save(drill);
        verify(stockMovementRepository).save(argThat(movement ->
                movement.getQuantity() == -4
                        && movement.getType() == MovementType.RENTAL_WITHDRAWAL
                        && movement.getReference().equals("rent-1")
                        && movement.getOperatorId().equals("operator-1")));
    }

    @Test
    void reserve_InsufficientStock_ThrowsAndLeavesStockUntouched() {
        // Given
        when(productRepository.findByProductIdWithLock("PROD-002")).thenReturn(Optional.of(mixer));

        // When & Then
        assertThatThrownBy(() -> stockLedgerService.reserve("PROD-002", 3, "rent-1", "operator-1"))
                .isInstanceOf(InsufficientStockException.class)
                .satisfies(ex -> {
                    InsufficientStockException insufficient = (InsufficientStockException) ex;
                    assertThat(insufficient.getProductId()).isEqualTo("PROD-002");
                    assertThat(insufficient.getAvailable()).isEqualTo(2);
                    assertThat(insufficient.getRequested()).isEqualTo(3);
                });

        assertThat(mixer.getStockOnHand()).isEqualTo(2);
        verify(productRepository, never()).save(any());
        verify(stockMovementRepository, never()).save(any());
    }

    @Test
    void reserve_UnknownProduct_ThrowsNotFound() {
        // Given
        when(productRepository.findByProductIdWithLock("PROD-404")).thenReturn(Optional.empty());

        // When & Then
        assertThatThrownBy(() -> stockLedgerService.reserve("PROD-404", 1, "rent-1", "operator-1"))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("PROD-404");
    }

    @Test
    void reserve_NonPositiveQuantity_RejectedBeforeLocking() {
        assertThatThrownBy(() -> stockLedgerService.reserve("PROD-001", 0, "rent-1", "operator-1"))
                .isInstanceOf(ValidationException.class);

        verify(productRepository, never()).findByProductIdWithLock(any());
    }

    @Test
    void credit_PositiveQuantity_IncrementsAndRecordsMovement() {
        // Given
        when(productRepository.findByProductIdWithLock("PROD-002")).thenReturn(Optional.of(mixer));

        // When
        stockLedgerService.credit("PROD-002", 2, MovementType.RENTAL_CANCELLATION, "rent-9", null);

        // Then
        assertThat(mixer.getStockOnHand()).isEqualTo(4);
        verify(stockMovementRepository).save(argThat(movement ->
                movement.getQuantity() == 2 && movement.getType() == MovementType.RENTAL_CANCELLATION));
    }

    @Test
    void credit_ZeroQuantity_IsNoOp() {
        // Given
        when(productRepository.findByProductIdWithLock("PROD-001")).thenReturn(Optional.of(drill));

        // When
        stockLedgerService.credit("PROD-001", 0, MovementType.RENTAL_RETURN, "rent-1", "operator-1");

        // Then
        assertThat(drill.getStockOnHand()).isEqualTo(10);
        verify(productRepository, never()).save(any());
        verify(stockMovementRepository, never()).save(any(StockMovement.class));
    }

    @Test
    void credit_NegativeQuantity_Rejected() {
        assertThatThrownBy(() -> stockLedgerService.credit("PROD-001", -1, MovementType.RENTAL_RETURN, "rent-1", "op"))
                .isInstanceOf(ValidationException.class);

        verify(productRepository, never()).findByProductIdWithLock(any());
    }

    @Test
    void lockProducts_LocksInAscendingIdOrderWithoutDuplicates() {
        // Given
        List<String> ordered = List.of("PROD-001", "PROD-002");
        when(productRepository.findAllByProductIdInWithLock(ordered)).thenReturn(List.of(drill, mixer));

        // When
        Map<String, Product> locked = stockLedgerService.lockProducts(List.of("PROD-002", "PROD-001", "PROD-002"));

        // Then
        assertThat(locked).containsOnlyKeys("PROD-001", "PROD-002");
        verify(productRepository).findAllByProductIdInWithLock(ordered);
    }

    @Test
    void lockProducts_OneUnknownProduct_ThrowsNotFound() {
        // Given
        List<String> ordered = List.of("PROD-001", "PROD-404");
        when(productRepository.findAllByProductIdInWithLock(ordered)).thenReturn(List.of(drill));

        // When & Then
        assertThatThrownBy(() -> stockLedgerService.lockProducts(List.of("PROD-404", "PROD-001")))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("PROD-404");
    }

    @Test
    void lockProducts_NothingRequested_NoQuery() {
        assertThat(stockLedgerService.lockProducts(List.of())).isEmpty();
        verify(productRepository, never()).findAllByProductIdInWithLock(any());
    }

    @Test
    void findLowStockProducts_InclusiveBoundaryByDefault() {
        // Given
        when(productRepository.findAtOrBelowMinimumStock()).thenReturn(List.of(mixer));

        // When
        List<Product> low = stockLedgerService.findLowStockProducts();

        // Then
        assertThat(low).containsExactly(mixer);
        verify(productRepository, never()).findBelowMinimumStock();
    }

    @Test
    void findLowStockProducts_ExclusiveBoundaryWhenConfigured() {
        // Given
        rentalProperties.getStock().setLowStockBoundary(LowStockBoundary.EXCLUSIVE);
        when(productRepository.findBelowMinimumStock()).thenReturn(List.of());

        // When
        List<Product> low = stockLedgerService.findLowStockProducts();

        // Then
        assertThat(low).isEmpty();
        verify(productRepository, never()).findAtOrBelowMinimumStock();
    }

    private Product product(String productId, int stockOnHand) {
        Product product = new Product();
        product.setProductId(productId);
        product.setName(productId);
        product.setStockOnHand(stockOnHand);
        product.setMinimumStock(2);
        product.setUnitPrice(new BigDecimal("2.00"));
        return product;
    }
}
