package org.rentalledger.common.dto.request;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProcessReturnRequest {
    private String transactionId;
    private String operatorId;
    private List<ReturnLineRequest> returns;
    private String notes;
}
