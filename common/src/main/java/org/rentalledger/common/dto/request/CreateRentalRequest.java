package org.rentalledger.common.dto.request;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateRentalRequest {
    private String customerId;
    private String operatorId;
    private LocalDateTime dueAt;
    private String notes;
    private List<RentalLineRequest> lines;
}
