package org.rentalledger.common.dto.request;

import org.junit.jupiter.api.Test;
import org.rentalledger.common.exception.ErrorKind;
import org.rentalledger.common.exception.ValidationException;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestedPriceTest {

    @Test
    void catalogDefault_ResolvesToCatalogPriceAtMoneyScale() {
        BigDecimal resolved = RequestedPrice.catalogDefault().resolve(new BigDecimal("2"));

        assertThat(resolved).isEqualTo(new BigDecimal("2.00"));
        assertThat(RequestedPrice.catalogDefault().isOverride()).isFalse();
    }

    @Test
    void override_IgnoresCatalogPrice() {
        RequestedPrice negotiated = RequestedPrice.override(new BigDecimal("1.75"));

        assertThat(negotiated.isOverride()).isTrue();
        assertThat(negotiated.resolve(new BigDecimal("9.99"))).isEqualTo(new BigDecimal("1.75"));
    }

    @Test
    void override_MoreThanTwoDecimalPlaces_RejectedInsteadOfRounded() {
        assertThatThrownBy(() -> RequestedPrice.override(new BigDecimal("1.005")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("at most 2 decimal places")
                .hasMessageContaining("1.005");
    }

    @Test
    void override_TrailingZerosBeyondMoneyScale_Accepted() {
        assertThat(RequestedPrice.override(new BigDecimal("3.5000")).resolve(BigDecimal.ONE))
                .isEqualTo(new BigDecimal("3.50"));
        assertThat(RequestedPrice.override(new BigDecimal("12")).resolve(BigDecimal.ONE))
                .isEqualTo(new BigDecimal("12.00"));
    }

    @Test
    void override_ZeroIsAllowed() {
        assertThat(RequestedPrice.override(BigDecimal.ZERO).resolve(BigDecimal.TEN))
                .isEqualTo(new BigDecimal("0.00"));
    }

    @Test
    void override_NegativeRejected() {
        assertThatThrownBy(() -> RequestedPrice.override(new BigDecimal("-0.01")))
                .isInstanceOf(ValidationException.class)
                .satisfies(ex -> assertThat(((ValidationException) ex).getKind()).isEqualTo(ErrorKind.VALIDATION));
    }

    @Test
    void override_NullRejected() {
        assertThatThrownBy(() -> RequestedPrice.override(null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("must not be null");
    }

    @Test
    void lineRequestWithoutPrice_FallsBackToCatalogDefault() {
        RentalLineRequest line = new RentalLineRequest();
        line.setProductId("PROD-001");
        line.setQuantity(3);

        assertThat(line.getPriceOrDefault()).isEqualTo(RequestedPrice.catalogDefault());
    }
}
