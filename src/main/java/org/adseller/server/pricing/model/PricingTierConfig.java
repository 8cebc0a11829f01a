package org.adseller.server.pricing.model;

import lombok.Builder;
import lombok.Value;
import org.adseller.server.identity.Tier;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-deployment pricing table: tier discounts, volume breakpoints, custom rules and global price bounds.
 */
@Value
@Builder(toBuilder = true)
public class PricingTierConfig {

    Map<Tier, TierPricing> tiers;

    /**
     * Ordered by {@link VolumeBreakpoint#getMinImpressions()}, strictly increasing.
     */
    @Builder.Default
    List<VolumeBreakpoint> volumeBreakpoints = Collections.emptyList();

    @Builder.Default
    List<PricingRule> rules = Collections.emptyList();

    @Builder.Default
    String currency = "USD";

    @Builder.Default
    BigDecimal globalFloorCpm = BigDecimal.ZERO;

    BigDecimal globalCeilingCpm;

    /**
     * Returns pricing of the given tier, falling back to the public tier when the tier is not configured.
     */
    public TierPricing tierPricing(Tier tier) {
        final TierPricing tierPricing = tiers.get(tier);
        return tierPricing != null ? tierPricing : tiers.get(Tier.PUBLIC);
    }

    public static PricingTierConfig defaultConfig() {
        final Map<Tier, TierPricing> tiers = new EnumMap<>(Tier.class);
        tiers.put(Tier.PUBLIC, TierPricing.builder()
                .showExactPrice(false)
                .priceRangeSpread(new BigDecimal("0.20"))
                .build());
        tiers.put(Tier.SEAT, TierPricing.builder()
                .tierDiscount(new BigDecimal("0.05"))
                .showExactPrice(true)
                .build());
        tiers.put(Tier.AGENCY, TierPricing.builder()
                .tierDiscount(new BigDecimal("0.10"))
                .showExactPrice(true)
                .negotiationEnabled(true)
                .volumeDiscountsEnabled(true)
                .build());
        tiers.put(Tier.ADVERTISER, TierPricing.builder()
                .tierDiscount(new BigDecimal("0.15"))
                .showExactPrice(true)
                .negotiationEnabled(true)
                .volumeDiscountsEnabled(true)
                .build());

        return PricingTierConfig.builder()
                .tiers(Collections.unmodifiableMap(tiers))
                .volumeBreakpoints(List.of(
                        VolumeBreakpoint.of(5_000_000L, new BigDecimal("0.05")),
                        VolumeBreakpoint.of(10_000_000L, new BigDecimal("0.10")),
                        VolumeBreakpoint.of(20_000_000L, new BigDecimal("0.15")),
                        VolumeBreakpoint.of(50_000_000L, new BigDecimal("0.20"))))
                .build();
    }
}
