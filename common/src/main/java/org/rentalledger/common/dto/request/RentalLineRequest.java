package org.rentalledger.common.dto.request;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RentalLineRequest {
    private String productId;
    private Integer quantity;
    private RequestedPrice price;

    public RentalLineRequest(String productId, Integer quantity) {
        this(productId, quantity, RequestedPrice.catalogDefault());
    }

    public RequestedPrice getPriceOrDefault() {
        return price != null ? price : RequestedPrice.catalogDefault();
    }
}
