package org.adseller.server.pricing.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Pricing settings of a single buyer tier.
 */
@Value
@Builder(toBuilder = true)
public class TierPricing {

    /**
     * Fraction in [0,1) taken off the base price.
     */
    @Builder.Default
    BigDecimal tierDiscount = BigDecimal.ZERO;

    /**
     * If false, buyers of this tier see a price range instead of a point price.
     */
    boolean showExactPrice;

    /**
     * Half-width of the displayed range as a fraction of the base price.
     */
    @Builder.Default
    BigDecimal priceRangeSpread = BigDecimal.ZERO;

    boolean negotiationEnabled;

    boolean volumeDiscountsEnabled;
}
