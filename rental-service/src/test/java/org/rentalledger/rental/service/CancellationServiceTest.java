package org.rentalledger.rental.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.rentalledger.common.dto.response.RentalTransactionView;
import org.rentalledger.common.enums.MovementType;
import org.rentalledger.common.enums.RentalStatus;
import org.rentalledger.common.exception.InvalidStateException;
import org.rentalledger.common.exception.ResourceNotFoundException;
import org.rentalledger.common.tx.AtomicUnit;
import org.rentalledger.inventory.service.StockLedgerService;
import org.rentalledger.rental.entity.RentalTransaction;
import org.rentalledger.rental.repository.RentalTransactionRepository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.rentalledger.rental.service.RentalFixtures.CLOCK;
import static org.rentalledger.rental.service.RentalFixtures.NOW;
import static org.rentalledger.rental.service.RentalFixtures.line;
import static org.rentalledger.rental.service.RentalFixtures.runInline;
import static org.rentalledger.rental.service.RentalFixtures.transaction;

@ExtendWith(MockitoExtension.class)
class CancellationServiceTest {

    @Mock
    private RentalTransactionRepository rentalTransactionRepository;

    @Mock
    private StockLedgerService stockLedgerService;

    @Mock
    private AtomicUnit atomicUnit;

    private CancellationService cancellationService;

    @BeforeEach
    void setUp() {
        cancellationService = new CancellationService(rentalTransactionRepository, stockLedgerService, atomicUnit,
                new RentalTransactionMapper(), CLOCK);
        lenient().when(atomicUnit.execute(any())).thenAnswer(runInline());
        lenient().when(rentalTransactionRepository.save(any(RentalTransaction.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void cancelTransaction_CreditsOnlyOutstandingQuantity() {
        // Given
        RentalTransaction rental = transaction("rent-1",
                line("line-1", "PROD-001", 4, 1, "2.00"),
                line("line-2", "PROD-002", 2, 2, "5.00"));
        when(rentalTransactionRepository.findByIdWithLock("rent-1")).thenReturn(Optional.of(rental));

        // When
        RentalTransactionView view = cancellationService.cancelTransaction("rent-1");

        // Then
        assertThat(view.getStatus()).isEqualTo(RentalStatus.CANCELLED);
        assertThat(view.getAmountOwed()).isEqualTo(new BigDecimal("0.00"));
        assertThat(view.getCancelledAt()).isEqualTo(NOW);
        assertThat(view.getLines()).allSatisfy(line ->
                assertThat(line.getQuantityReturned()).isEqualTo(line.getQuantityWithdrawn()));
        verify(stockLedgerService).credit("PROD-001", 3, MovementType.RENTAL_CANCELLATION, "rent-1", null);
        verify(stockLedgerService, never()).credit(eq("PROD-002"), anyInt(),
                any(), any(), any());
    }

    @Test
    void cancelTransaction_LocksOutstandingProductsBeforeCrediting() {
        // Given: lines listed B before A, plus one line already back
        RentalTransaction rental = transaction("rent-1",
                line("line-1", "PROD-002", 2, 0, "5.00"),
                line("line-2", "PROD-003", 1, 1, "9.00"),
                line("line-3", "PROD-001", 4, 0, "2.00"));
        when(rentalTransactionRepository.findByIdWithLock("rent-1")).thenReturn(Optional.of(rental));

        // When
        cancellationService.cancelTransaction("rent-1");

        // Then
        InOrder inOrder = inOrder(stockLedgerService);
        inOrder.verify(stockLedgerService).lockProducts(List.of("PROD-002", "PROD-001"));
        inOrder.verify(stockLedgerService).credit("PROD-002", 2, MovementType.RENTAL_CANCELLATION, "rent-1", null);
        inOrder.verify(stockLedgerService).credit("PROD-001", 4, MovementType.RENTAL_CANCELLATION, "rent-1", null);
    }

    @Test
    void cancelTransaction_OverdueTransaction_Allowed() {
        // Given
        RentalTransaction rental = transaction("rent-1", line("line-1", "PROD-001", 4, 0, "2.00"));
        rental.setStatus(RentalStatus.OVERDUE);
        when(rentalTransactionRepository.findByIdWithLock("rent-1")).thenReturn(Optional.of(rental));

        // When
        RentalTransactionView view = cancellationService.cancelTransaction("rent-1");

        // Then
        assertThat(view.getStatus()).isEqualTo(RentalStatus.CANCELLED);
        verify(stockLedgerService).credit("PROD-001", 4, MovementType.RENTAL_CANCELLATION, "rent-1", null);
    }

    @Test
    void cancelTransaction_AlreadyCancelled_InvalidStateAndNoCredit() {
        // Given
        RentalTransaction rental = transaction("rent-1", line("line-1", "PROD-001", 4, 4, "2.00"));
        rental.cancel(NOW);
        when(rentalTransactionRepository.findByIdWithLock("rent-1")).thenReturn(Optional.of(rental));

        // When & Then
        assertThatThrownBy(() -> cancellationService.cancelTransaction("rent-1"))
                .isInstanceOf(InvalidStateException.class)
                .hasMessageContaining("CANCELLED");
        verify(stockLedgerService, never()).credit(any(), anyInt(), any(), any(), any());
    }

    @Test
    void cancelTransaction_Completed_InvalidState() {
        // Given
        RentalTransaction rental = transaction("rent-1", line("line-1", "PROD-001", 4, 0, "2.00"));
        rental.complete(NOW);
        when(rentalTransactionRepository.findByIdWithLock("rent-1")).thenReturn(Optional.of(rental));

        // When & Then
        assertThatThrownBy(() -> cancellationService.cancelTransaction("rent-1"))
                .isInstanceOf(InvalidStateException.class);
        assertThat(rental.getLines().get(0).getQuantityReturned()).isZero();
    }

    @Test
    void cancelTransaction_Unknown_NotFound() {
        when(rentalTransactionRepository.findByIdWithLock("rent-404")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> cancellationService.cancelTransaction("rent-404"))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
