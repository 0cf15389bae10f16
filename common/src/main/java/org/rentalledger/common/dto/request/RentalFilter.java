package org.rentalledger.common.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.rentalledger.common.enums.RentalStatus;

import java.time.LocalDateTime;

/**
 * Criteria for listing rental transactions. Null fields are ignored; the withdrawal date range
 * is inclusive on both ends.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RentalFilter {
    private RentalStatus status;
    private String customerId;
    private LocalDateTime withdrawnFrom;
    private LocalDateTime withdrawnTo;
    private boolean overdueOnly;

    public static RentalFilter all() {
        return new RentalFilter();
    }
}
