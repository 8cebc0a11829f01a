package org.adseller.server.pricing.model;

import lombok.Builder;
import lombok.Value;
import org.adseller.server.identity.Tier;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class PricingResult {

    String productId;

    Tier tier;

    BigDecimal basePrice;

    BigDecimal tierDiscount;

    BigDecimal ruleDiscount;

    BigDecimal volumeDiscount;

    /**
     * Rounded to two decimals, never below {@link #floorPrice}.
     */
    BigDecimal finalPrice;

    BigDecimal floorPrice;

    /**
     * True when the discounted price fell below the floor and was raised to it.
     */
    boolean flooredApplied;

    boolean ceilingApplied;

    String currency;

    List<String> appliedRules;

    String rationale;
}
