package org.rentalledger.common.dto.request;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.rentalledger.common.exception.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Unit price asked for on a rental line: either the catalog price at withdrawal time or a
 * negotiated override. Resolved exactly once, when the line is created.
 */
@ToString
@EqualsAndHashCode
public final class RequestedPrice {

    public static final int MONEY_SCALE = 2;

    private static final RequestedPrice CATALOG_DEFAULT = new RequestedPrice(null);

    private final BigDecimal override;

    private RequestedPrice(BigDecimal override) {
        this.override = override;
    }

    public static RequestedPrice catalogDefault() {
        return CATALOG_DEFAULT;
    }

    public static RequestedPrice override(BigDecimal amount) {
        if (amount == null) {
            throw new ValidationException("price", "Override price must not be null");
        }
        if (amount.signum() < 0) {
            throw new ValidationException("price", "Override price must not be negative: " + amount);
        }
        if (amount.stripTrailingZeros().scale() > MONEY_SCALE) {
            throw new ValidationException("price",
                    "Override price must have at most " + MONEY_SCALE + " decimal places: " + amount.toPlainString());
        }
        return new RequestedPrice(amount.setScale(MONEY_SCALE));
    }

    public boolean isOverride() {
        return override != null;
    }

    public BigDecimal resolve(BigDecimal catalogPrice) {
        return isOverride() ? override : catalogPrice.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
