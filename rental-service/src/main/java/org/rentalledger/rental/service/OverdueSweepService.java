package org.rentalledger.rental.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.rentalledger.common.enums.RentalStatus;
import org.rentalledger.common.tx.AtomicUnit;
import org.rentalledger.rental.repository.RentalTransactionRepository;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

import static org.rentalledger.common.util.RequestValidation.requireNonNull;

@Service
@RequiredArgsConstructor
@Slf4j
public class OverdueSweepService {

    private final RentalTransactionRepository rentalTransactionRepository;
    private final AtomicUnit atomicUnit;
    private final Clock clock;

    /**
     * Move every ACTIVE transaction due before {@code now} to OVERDUE and return how many moved.
     * Running it again with the same {@code now} changes nothing.
     */
    public int sweepOverdue(LocalDateTime now) {
        requireNonNull(now, "now");

        int swept = atomicUnit.execute(() -> rentalTransactionRepository.markOverdue(
                now, LocalDateTime.now(clock), RentalStatus.ACTIVE, RentalStatus.OVERDUE));

        if (swept > 0) {
            log.info("Overdue sweep flagged transactions: count={}, now={}", swept, now);
        } else {
            log.debug("Overdue sweep found nothing to flag: now={}", now);
        }
        return swept;
    }
}
