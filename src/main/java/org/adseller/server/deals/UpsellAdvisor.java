package org.adseller.server.deals;

import org.adseller.server.audience.model.AudienceRequest;
import org.adseller.server.audience.model.RequestedCapability;
import org.adseller.server.deals.model.Decision;
import org.adseller.server.deals.model.DecisionOutcome;
import org.adseller.server.deals.model.Proposal;
import org.adseller.server.deals.model.UpsellSuggestion;
import org.adseller.server.deals.model.UpsellType;
import org.adseller.server.pricing.PricingEngine;
import org.adseller.server.pricing.model.VolumeBreakpoint;
import org.adseller.server.settings.model.Product;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.collections4.ListUtils;
import org.apache.commons.collections4.SetUtils;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Suggests other ways to book with the seller alongside a decision.
 * <p>
 * A rejected proposal gets alternative products which publish the requested capabilities, or products of the same
 * inventory channel when nothing was requested. Any other decision gets a volume upgrade to the next discount
 * breakpoint and products of other inventory channels.
 */
public class UpsellAdvisor {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final PricingEngine pricingEngine;
    private final int maxProductSuggestions;

    public UpsellAdvisor(PricingEngine pricingEngine, int maxProductSuggestions) {
        if (maxProductSuggestions < 0) {
            throw new IllegalArgumentException(
                    "Max product suggestions must be non-negative, but was " + maxProductSuggestions);
        }

        this.pricingEngine = Objects.requireNonNull(pricingEngine);
        this.maxProductSuggestions = maxProductSuggestions;
    }

    public List<UpsellSuggestion> suggest(Proposal proposal, Product product, Decision decision, List<Product> catalog) {
        final Set<String> requestedTags = requestedTags(proposal.getAudienceRequest());
        final List<Product> otherProducts = ListUtils.emptyIfNull(catalog).stream()
                .filter(Objects::nonNull)
                .filter(candidate -> !Objects.equals(candidate.getId(), product.getId()))
                .toList();

        if (decision.getOutcome() == DecisionOutcome.rejected) {
            return alternatives(product, requestedTags, otherProducts);
        }

        final List<UpsellSuggestion> suggestions = new ArrayList<>();
        volumeUpgrade(proposal, product).ifPresent(suggestions::add);
        suggestions.addAll(crossSells(product, requestedTags, otherProducts));
        return Collections.unmodifiableList(suggestions);
    }

    private List<UpsellSuggestion> alternatives(Product product, Set<String> requestedTags, List<Product> candidates) {
        final Predicate<Product> eligible = requestedTags.isEmpty()
                ? candidate -> StringUtils.equals(candidate.getInventoryType(), product.getInventoryType())
                : candidate -> overlap(candidate, requestedTags) > 0;

        return rank(candidates, eligible, requestedTags).stream()
                .map(candidate -> UpsellSuggestion.builder()
                        .type(UpsellType.alternative_product)
                        .productId(candidate.getId())
                        .message(requestedTags.isEmpty()
                                ? "Consider %s, also %s inventory".formatted(
                                        title(candidate), candidate.getInventoryType())
                                : "Consider %s, it publishes %s".formatted(
                                        title(candidate), sharedTags(candidate, requestedTags)))
                        .build())
                .toList();
    }

    private Optional<UpsellSuggestion> volumeUpgrade(Proposal proposal, Product product) {
        return pricingEngine.nextVolumeBreakpoint(proposal.getBuyerContext(), proposal.getVolume())
                .map(breakpoint -> UpsellSuggestion.builder()
                        .type(UpsellType.volume_upgrade)
                        .productId(product.getId())
                        .volume(breakpoint.getMinImpressions())
                        .message("Book %d impressions for a %s%% volume discount".formatted(
                                breakpoint.getMinImpressions(), percent(breakpoint)))
                        .build());
    }

    private List<UpsellSuggestion> crossSells(Product product, Set<String> requestedTags, List<Product> candidates) {
        final Set<String> interests = requestedTags.isEmpty()
                ? SetUtils.emptyIfNull(product.getCapabilityTags())
                : requestedTags;

        return rank(candidates,
                candidate -> candidate.getInventoryType() != null
                        && !StringUtils.equals(candidate.getInventoryType(), product.getInventoryType()),
                interests).stream()
                .map(candidate -> UpsellSuggestion.builder()
                        .type(UpsellType.cross_sell)
                        .productId(candidate.getId())
                        .message("Extend the campaign to %s inventory with %s".formatted(
                                candidate.getInventoryType(), title(candidate)))
                        .build())
                .toList();
    }

    private List<Product> rank(List<Product> candidates, Predicate<Product> eligible, Set<String> tags) {
        return candidates.stream()
                .filter(eligible)
                .sorted(Comparator.comparingInt((Product candidate) -> overlap(candidate, tags)).reversed()
                        .thenComparing(Product::getId))
                .limit(maxProductSuggestions)
                .toList();
    }

    private static Set<String> requestedTags(AudienceRequest audienceRequest) {
        if (audienceRequest == null) {
            return Collections.emptySet();
        }

        return ListUtils.emptyIfNull(audienceRequest.getRequestedCapabilities()).stream()
                .filter(Objects::nonNull)
                .map(RequestedCapability::getTag)
                .filter(StringUtils::isNotBlank)
                .collect(Collectors.toSet());
    }

    private static int overlap(Product candidate, Set<String> tags) {
        return CollectionUtils.intersection(SetUtils.emptyIfNull(candidate.getCapabilityTags()), tags).size();
    }

    private static String sharedTags(Product candidate, Set<String> tags) {
        return SetUtils.emptyIfNull(candidate.getCapabilityTags()).stream()
                .filter(tags::contains)
                .sorted()
                .collect(Collectors.joining(", "));
    }

    private static String title(Product product) {
        return StringUtils.isNotBlank(product.getName())
                ? "%s (%s)".formatted(product.getName(), product.getId())
                : product.getId();
    }

    private static String percent(VolumeBreakpoint breakpoint) {
        return breakpoint.getDiscount().multiply(HUNDRED).stripTrailingZeros().toPlainString();
    }
}
