package org.rentalledger.rental.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.rentalledger.common.result.OperationResult;
import org.rentalledger.rental.service.RentalTransactionFacade;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Periodically flags past-due rentals as overdue.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "rental.overdue-sweep", name = "enabled", havingValue = "true", matchIfMissing = true)
public class OverdueSweepScheduler {

    private final RentalTransactionFacade rentalTransactionFacade;
    private final Clock clock;

    @Scheduled(cron = "${rental.overdue-sweep.cron:0 */5 * * * *}")
    public void sweep() {
        OperationResult<Integer> result = rentalTransactionFacade.sweepOverdue(LocalDateTime.now(clock));
        if (result.isFailure()) {
            // a conflicting writer held the rows; the next run picks them up
            log.warn("Scheduled overdue sweep did not complete: kind={}, reason={}",
                    result.getError().getKind(), result.getError().getMessage());
        }
    }
}
