package org.rentalledger.common.dto.request;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReturnLineRequest {
    private String lineId;
    private Integer quantity;
}
