package org.adseller.server.spring.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.adseller.server.exception.ConfigurationException;
import org.adseller.server.identity.BuyerTierResolver;
import org.adseller.server.identity.Tier;
import org.adseller.server.pricing.PricingEngine;
import org.adseller.server.pricing.TieredPricingEngine;
import org.adseller.server.pricing.model.PricingRule;
import org.adseller.server.pricing.model.PricingTierConfig;
import org.adseller.server.pricing.model.TierPricing;
import org.adseller.server.pricing.model.VolumeBreakpoint;
import org.apache.commons.collections4.ListUtils;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Configuration
public class PricingConfiguration {

    @Bean
    BuyerTierResolver buyerTierResolver() {
        return new BuyerTierResolver();
    }

    @Bean
    PricingEngine pricingEngine(PricingConfigurationProperties properties, BuyerTierResolver buyerTierResolver) {
        return new TieredPricingEngine(properties.toComponentProperties(), buyerTierResolver);
    }

    @Bean
    @ConfigurationProperties(prefix = "pricing")
    PricingConfigurationProperties pricingConfigurationProperties() {
        return new PricingConfigurationProperties();
    }

    @Validated
    @NoArgsConstructor
    @Data
    static class PricingConfigurationProperties {

        @NotBlank
        private String currency = "USD";

        @NotNull
        @DecimalMin("0")
        private BigDecimal globalFloorCpm = BigDecimal.ZERO;

        private BigDecimal globalCeilingCpm;

        /**
         * Tier rows keyed by tier name; built-in defaults are used when none is configured.
         */
        @Valid
        private Map<String, TierProperties> tiers;

        @Valid
        private List<VolumeBreakpointProperties> volumeBreakpoints;

        @Valid
        private List<PricingRuleProperties> rules;

        PricingTierConfig toComponentProperties() {
            final PricingTierConfig defaults = PricingTierConfig.defaultConfig();

            return defaults.toBuilder()
                    .currency(currency)
                    .globalFloorCpm(globalFloorCpm)
                    .globalCeilingCpm(globalCeilingCpm)
                    .tiers(MapUtils.isEmpty(tiers) ? defaults.getTiers() : toTiers(tiers))
                    .volumeBreakpoints(volumeBreakpoints == null
                            ? defaults.getVolumeBreakpoints()
                            : volumeBreakpoints.stream().map(VolumeBreakpointProperties::toBreakpoint).toList())
                    .rules(ListUtils.emptyIfNull(rules).stream().map(PricingRuleProperties::toRule).toList())
                    .build();
        }

        private static Map<Tier, TierPricing> toTiers(Map<String, TierProperties> tiers) {
            final Map<Tier, TierPricing> result = new EnumMap<>(Tier.class);
            tiers.forEach((name, properties) -> result.put(toTier(name), properties.toTierPricing()));
            return result;
        }
    }

    private static Tier toTier(String name) {
        try {
            return Tier.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown pricing tier: " + name, e);
        }
    }

    @NoArgsConstructor
    @Data
    static class TierProperties {

        @NotNull
        @DecimalMin("0")
        private BigDecimal discount = BigDecimal.ZERO;

        private boolean showExactPrice;

        @NotNull
        @DecimalMin("0")
        private BigDecimal priceRangeSpread = BigDecimal.ZERO;

        private boolean negotiationEnabled;

        private boolean volumeDiscountsEnabled;

        TierPricing toTierPricing() {
            return TierPricing.builder()
                    .tierDiscount(discount)
                    .showExactPrice(showExactPrice)
                    .priceRangeSpread(priceRangeSpread)
                    .negotiationEnabled(negotiationEnabled)
                    .volumeDiscountsEnabled(volumeDiscountsEnabled)
                    .build();
        }
    }

    @NoArgsConstructor
    @Data
    static class VolumeBreakpointProperties {

        @PositiveOrZero
        private long minImpressions;

        @NotNull
        private BigDecimal discount;

        VolumeBreakpoint toBreakpoint() {
            return VolumeBreakpoint.of(minImpressions, discount);
        }
    }

    @NoArgsConstructor
    @Data
    static class PricingRuleProperties {

        @NotBlank
        private String id;

        private String name;

        private int priority;

        private String tier;

        private Set<String> agencyIds;

        private Set<String> advertiserIds;

        private Set<String> holdingCompanyIds;

        private Set<String> productIds;

        private Set<String> inventoryTypes;

        private BigDecimal discount;

        private BigDecimal priceOverride;

        private boolean active = true;

        PricingRule toRule() {
            return PricingRule.builder()
                    .ruleId(id)
                    .ruleName(ObjectUtils.defaultIfNull(name, id))
                    .priority(priority)
                    .tier(tier != null ? toTier(tier) : null)
                    .agencyIds(agencyIds)
                    .advertiserIds(advertiserIds)
                    .holdingCompanyIds(holdingCompanyIds)
                    .productIds(productIds)
                    .inventoryTypes(inventoryTypes)
                    .discount(ObjectUtils.defaultIfNull(discount, BigDecimal.ZERO))
                    .priceOverride(priceOverride)
                    .active(active)
                    .build();
        }
    }
}
