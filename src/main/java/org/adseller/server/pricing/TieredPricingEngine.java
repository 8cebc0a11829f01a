package org.adseller.server.pricing;

import org.adseller.server.exception.AdSellerException;
import org.adseller.server.identity.BuyerContext;
import org.adseller.server.identity.BuyerIdentity;
import org.adseller.server.identity.BuyerTierResolver;
import org.adseller.server.identity.Tier;
import org.adseller.server.pricing.model.PriceAcceptance;
import org.adseller.server.pricing.model.PriceDisplay;
import org.adseller.server.pricing.model.PricingResult;
import org.adseller.server.pricing.model.PricingRule;
import org.adseller.server.pricing.model.PricingTierConfig;
import org.adseller.server.pricing.model.TierPricing;
import org.adseller.server.pricing.model.VolumeBreakpoint;
import org.adseller.server.settings.model.Product;
import org.apache.commons.collections4.ListUtils;
import org.apache.commons.lang3.ObjectUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link PricingEngine} driven by a {@link PricingTierConfig}.
 * <p>
 * Discounts compose multiplicatively in a fixed order: tier, custom rule, volume. The volume discount is
 * therefore taken from the already negotiated tier price. Arithmetic is exact and rounding to cents happens
 * once, on the final price.
 */
public class TieredPricingEngine implements PricingEngine {

    private static final int PRICE_SCALE = 2;
    private static final int RATIO_SCALE = 6;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final String RATIONALE_DELIMITER = " | ";

    private final PricingTierConfig config;
    private final BuyerTierResolver tierResolver;

    public TieredPricingEngine(PricingTierConfig config, BuyerTierResolver tierResolver) {
        PricingTierConfigValidator.validate(config);

        this.config = config;
        this.tierResolver = Objects.requireNonNull(tierResolver);
    }

    @Override
    public PricingResult calculatePrice(String productId,
                                        BigDecimal basePrice,
                                        BuyerContext buyerContext,
                                        long volume) {

        return calculate(productId, null, basePrice, config.getGlobalFloorCpm(), buyerContext, volume);
    }

    @Override
    public PricingResult calculatePrice(Product product, BuyerContext buyerContext, long volume) {
        final BigDecimal productFloor = ObjectUtils.max(product.getFloorCpm(), config.getGlobalFloorCpm());
        return calculate(
                product.getId(), product.getInventoryType(), product.getBaseCpm(), productFloor, buyerContext, volume);
    }

    private PricingResult calculate(String productId,
                                    String inventoryType,
                                    BigDecimal basePrice,
                                    BigDecimal floor,
                                    BuyerContext buyerContext,
                                    long volume) {

        if (basePrice == null || basePrice.signum() < 0) {
            throw new AdSellerException("Base price must be non-negative, but was " + basePrice);
        }
        if (volume < 0) {
            throw new AdSellerException("Volume must be non-negative, but was " + volume);
        }

        final Tier tier = tierResolver.resolveTier(buyerContext);
        final TierPricing tierPricing = config.tierPricing(tier);
        final BuyerIdentity identity = buyerContext != null ? buyerContext.getIdentity() : null;

        final List<String> appliedRules = new ArrayList<>();
        final List<String> rationale = new ArrayList<>();
        rationale.add("Base price: %s CPM".formatted(money(basePrice)));

        BigDecimal price = basePrice;

        final BigDecimal tierDiscount = tierPricing.getTierDiscount();
        if (tierDiscount.signum() > 0) {
            price = discount(price, tierDiscount);
            appliedRules.add("Tier discount: -%s%%".formatted(percent(tierDiscount, 0)));
            rationale.add("%s tier: -%s%%".formatted(tier.title(), percent(tierDiscount, 0)));
        }

        final List<PricingRule> matchingRules = matchingRules(tier, identity, productId, inventoryType);
        final Optional<PricingRule> overrideRule = matchingRules.stream()
                .filter(rule -> rule.getPriceOverride() != null)
                .findFirst();

        BigDecimal ruleDiscount = BigDecimal.ZERO;
        if (overrideRule.isPresent()) {
            final PricingRule rule = overrideRule.get();
            price = rule.getPriceOverride();
            final String entry = "Rule '%s': price override %s".formatted(rule.getRuleName(), money(price));
            appliedRules.add(entry);
            rationale.add(entry);
        } else {
            final Optional<PricingRule> discountRule = matchingRules.stream()
                    .filter(rule -> rule.getDiscount().signum() > 0)
                    .max(Comparator.comparing(PricingRule::getDiscount));
            if (discountRule.isPresent()) {
                ruleDiscount = discountRule.get().getDiscount();
                price = discount(price, ruleDiscount);
                final String entry = "Rule '%s': -%s%%".formatted(
                        discountRule.get().getRuleName(), percent(ruleDiscount, 0));
                appliedRules.add(entry);
                rationale.add(entry);
            }
        }

        final BigDecimal volumeDiscount = tierPricing.isVolumeDiscountsEnabled() && volume > 0
                ? resolveVolumeDiscount(volume)
                : BigDecimal.ZERO;
        if (volumeDiscount.signum() > 0) {
            price = discount(price, volumeDiscount);
            final String entry = "Volume discount: -%s%%".formatted(percent(volumeDiscount, 1));
            appliedRules.add(entry);
            rationale.add(entry);
        }

        boolean flooredApplied = false;
        if (price.compareTo(floor) < 0) {
            price = floor;
            flooredApplied = true;
            final String entry = "Floor enforced: " + money(floor);
            appliedRules.add(entry);
            rationale.add(entry);
        }

        boolean ceilingApplied = false;
        final BigDecimal ceiling = config.getGlobalCeilingCpm();
        if (ceiling != null && price.compareTo(ceiling) > 0) {
            ceilingApplied = true;
            final String entry;
            if (ceiling.compareTo(floor) >= 0) {
                price = ceiling;
                entry = "Ceiling enforced: " + money(ceiling);
            } else {
                // the floor wins over a lower ceiling
                price = floor;
                entry = "Ceiling %s is below floor, capped at floor: %s".formatted(money(ceiling), money(floor));
            }
            appliedRules.add(entry);
            rationale.add(entry);
        }

        final BigDecimal finalPrice = roundNotBelow(price, floor);
        rationale.add("Final price: %s CPM".formatted(money(finalPrice)));
        if (basePrice.signum() > 0 && finalPrice.compareTo(basePrice) < 0) {
            final BigDecimal savings = basePrice.subtract(finalPrice)
                    .divide(basePrice, RATIO_SCALE, RoundingMode.HALF_UP);
            rationale.add("(Total savings: %s%%)".formatted(percent(savings, 1)));
        }

        return PricingResult.builder()
                .productId(productId)
                .tier(tier)
                .basePrice(basePrice)
                .tierDiscount(tierDiscount)
                .ruleDiscount(ruleDiscount)
                .volumeDiscount(volumeDiscount)
                .finalPrice(finalPrice)
                .floorPrice(floor)
                .flooredApplied(flooredApplied)
                .ceilingApplied(ceilingApplied)
                .currency(config.getCurrency())
                .appliedRules(List.copyOf(appliedRules))
                .rationale(String.join(RATIONALE_DELIMITER, rationale))
                .build();
    }

    /**
     * Returns discount of the largest breakpoint not above the volume, zero when no breakpoint is reached.
     */
    public BigDecimal resolveVolumeDiscount(long volume) {
        BigDecimal result = BigDecimal.ZERO;
        for (VolumeBreakpoint breakpoint : ListUtils.emptyIfNull(config.getVolumeBreakpoints())) {
            if (breakpoint.getMinImpressions() > volume) {
                break;
            }
            result = breakpoint.getDiscount();
        }
        return result;
    }

    @Override
    public Optional<VolumeBreakpoint> nextVolumeBreakpoint(BuyerContext buyerContext, long volume) {
        if (!config.tierPricing(tierResolver.resolveTier(buyerContext)).isVolumeDiscountsEnabled()) {
            return Optional.empty();
        }

        final BigDecimal currentDiscount = resolveVolumeDiscount(volume);
        return ListUtils.emptyIfNull(config.getVolumeBreakpoints()).stream()
                .filter(breakpoint -> breakpoint.getMinImpressions() > volume)
                .filter(breakpoint -> breakpoint.getDiscount().compareTo(currentDiscount) > 0)
                .findFirst();
    }

    private List<PricingRule> matchingRules(Tier tier, BuyerIdentity identity, String productId, String inventoryType) {
        return ListUtils.emptyIfNull(config.getRules()).stream()
                .filter(PricingRule::isActive)
                .filter(rule -> rule.matches(tier, identity, productId, inventoryType))
                .sorted(Comparator.comparingInt(PricingRule::getPriority).reversed())
                .toList();
    }

    @Override
    public PriceDisplay getPriceDisplay(BigDecimal basePrice, BuyerContext buyerContext) {
        final TierPricing tierPricing = config.tierPricing(tierResolver.resolveTier(buyerContext));

        if (tierPricing.isShowExactPrice()) {
            final BigDecimal price = round(discount(basePrice, tierPricing.getTierDiscount()));
            return PriceDisplay.exact(price, config.getCurrency(), tierPricing.isNegotiationEnabled());
        }

        final BigDecimal spread = tierPricing.getPriceRangeSpread();
        final BigDecimal low = round(basePrice.multiply(BigDecimal.ONE.subtract(spread)));
        final BigDecimal high = round(basePrice.multiply(BigDecimal.ONE.add(spread)));
        return PriceDisplay.range(low, high, config.getCurrency());
    }

    @Override
    public PriceAcceptance isPriceAcceptable(BigDecimal offeredPrice, BigDecimal productFloor) {
        final BigDecimal globalFloor = config.getGlobalFloorCpm();
        if (offeredPrice.compareTo(globalFloor) < 0) {
            return PriceAcceptance.of(false, "Below global floor (%s CPM)".formatted(money(globalFloor)));
        }
        if (productFloor != null && offeredPrice.compareTo(productFloor) < 0) {
            return PriceAcceptance.of(false, "Below product floor (%s CPM)".formatted(money(productFloor)));
        }
        return PriceAcceptance.of(true, "Price acceptable");
    }

    private static BigDecimal discount(BigDecimal price, BigDecimal discount) {
        return price.multiply(BigDecimal.ONE.subtract(discount));
    }

    private static BigDecimal round(BigDecimal value) {
        return value.setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Rounds to cents; a floor with sub-cent precision is rounded up so the result never drops below it.
     */
    private static BigDecimal roundNotBelow(BigDecimal price, BigDecimal floor) {
        final BigDecimal rounded = round(price);
        return rounded.compareTo(floor) < 0 ? floor.setScale(PRICE_SCALE, RoundingMode.CEILING) : rounded;
    }

    private static String money(BigDecimal value) {
        return "$" + round(value).toPlainString();
    }

    private static String percent(BigDecimal fraction, int scale) {
        return fraction.multiply(HUNDRED).setScale(scale, RoundingMode.HALF_UP).toPlainString();
    }
}
