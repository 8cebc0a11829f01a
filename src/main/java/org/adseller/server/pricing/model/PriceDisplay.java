package org.adseller.server.pricing.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Price as shown to a buyer: a range for anonymous buyers, an exact tier price otherwise.
 */
@Value
@Builder
public class PriceDisplay {

    PriceDisplayType type;

    BigDecimal low;

    BigDecimal high;

    BigDecimal price;

    String currency;

    Boolean negotiationEnabled;

    String display;

    public static PriceDisplay range(BigDecimal low, BigDecimal high, String currency) {
        return PriceDisplay.builder()
                .type(PriceDisplayType.range)
                .low(low)
                .high(high)
                .currency(currency)
                .display("$%s-$%s CPM".formatted(low.toPlainString(), high.toPlainString()))
                .build();
    }

    public static PriceDisplay exact(BigDecimal price, String currency, boolean negotiationEnabled) {
        return PriceDisplay.builder()
                .type(PriceDisplayType.exact)
                .price(price)
                .currency(currency)
                .negotiationEnabled(negotiationEnabled)
                .display("$%s CPM".formatted(price.toPlainString()))
                .build();
    }
}
