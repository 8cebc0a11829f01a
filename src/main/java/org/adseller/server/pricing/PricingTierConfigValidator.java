package org.adseller.server.pricing;

import org.adseller.server.exception.ConfigurationException;
import org.adseller.server.identity.Tier;
import org.adseller.server.pricing.model.PricingRule;
import org.adseller.server.pricing.model.PricingTierConfig;
import org.adseller.server.pricing.model.TierPricing;
import org.adseller.server.pricing.model.VolumeBreakpoint;
import org.apache.commons.collections4.ListUtils;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

public class PricingTierConfigValidator {

    private PricingTierConfigValidator() {
    }

    public static void validate(PricingTierConfig config) {
        if (config == null) {
            throw new ConfigurationException("Pricing tier config must be present");
        }

        if (StringUtils.isBlank(config.getCurrency())) {
            throw new ConfigurationException("Pricing currency must be present");
        }

        validateTiers(config.getTiers());
        validateBreakpoints(ListUtils.emptyIfNull(config.getVolumeBreakpoints()));
        ListUtils.emptyIfNull(config.getRules()).forEach(PricingTierConfigValidator::validateRule);
        validateBounds(config.getGlobalFloorCpm(), config.getGlobalCeilingCpm());
    }

    private static void validateTiers(Map<Tier, TierPricing> tiers) {
        if (MapUtils.isEmpty(tiers) || tiers.get(Tier.PUBLIC) == null) {
            throw new ConfigurationException("Pricing for public tier must be configured");
        }

        tiers.forEach((tier, pricing) -> {
            if (pricing == null) {
                throw new ConfigurationException("Pricing for tier %s must not be empty".formatted(tier));
            }
            validateFraction(pricing.getTierDiscount(), "Tier %s discount".formatted(tier));
            validateFraction(pricing.getPriceRangeSpread(), "Tier %s price range spread".formatted(tier));
        });
    }

    private static void validateBreakpoints(List<VolumeBreakpoint> breakpoints) {
        VolumeBreakpoint previous = null;
        for (VolumeBreakpoint breakpoint : breakpoints) {
            if (breakpoint == null) {
                throw new ConfigurationException("Volume breakpoint must not be empty");
            }
            if (breakpoint.getMinImpressions() < 0) {
                throw new ConfigurationException("Volume breakpoint impressions must be non-negative, but was "
                        + breakpoint.getMinImpressions());
            }
            validateFraction(breakpoint.getDiscount(),
                    "Volume breakpoint %d discount".formatted(breakpoint.getMinImpressions()));

            if (previous != null) {
                if (breakpoint.getMinImpressions() <= previous.getMinImpressions()) {
                    throw new ConfigurationException("Volume breakpoints must be strictly increasing, but %d follows %d"
                            .formatted(breakpoint.getMinImpressions(), previous.getMinImpressions()));
                }
                if (breakpoint.getDiscount().compareTo(previous.getDiscount()) < 0) {
                    throw new ConfigurationException(
                            "Volume breakpoint discounts must not decrease, but %s at %d follows %s"
                                    .formatted(breakpoint.getDiscount(), breakpoint.getMinImpressions(),
                                            previous.getDiscount()));
                }
            }
            previous = breakpoint;
        }
    }

    private static void validateRule(PricingRule rule) {
        if (rule == null || StringUtils.isBlank(rule.getRuleId())) {
            throw new ConfigurationException("Pricing rule id must be present");
        }

        validateFraction(rule.getDiscount(), "Pricing rule %s discount".formatted(rule.getRuleId()));

        final BigDecimal priceOverride = rule.getPriceOverride();
        if (priceOverride != null && priceOverride.signum() < 0) {
            throw new ConfigurationException("Pricing rule %s price override must be non-negative, but was %s"
                    .formatted(rule.getRuleId(), priceOverride));
        }
    }

    private static void validateBounds(BigDecimal floor, BigDecimal ceiling) {
        if (floor == null || floor.signum() < 0) {
            throw new ConfigurationException("Global floor CPM must be non-negative, but was " + floor);
        }
        if (ceiling != null && ceiling.compareTo(floor) < 0) {
            throw new ConfigurationException("Global ceiling CPM %s must not be below global floor CPM %s"
                    .formatted(ceiling, floor));
        }
    }

    private static void validateFraction(BigDecimal value, String name) {
        if (value == null || value.signum() < 0 || value.compareTo(BigDecimal.ONE) >= 0) {
            throw new ConfigurationException("%s must be in range [0, 1), but was %s".formatted(name, value));
        }
    }
}
