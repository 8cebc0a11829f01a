package org.adseller.server.deals;

import org.adseller.server.audience.model.CoverageResult;
import org.adseller.server.audience.model.ValidationStatus;
import org.adseller.server.deals.model.CounterTerms;
import org.adseller.server.deals.model.Decision;
import org.adseller.server.deals.model.DecisionOutcome;
import org.adseller.server.deals.model.Proposal;
import org.adseller.server.pricing.PricingEngine;
import org.adseller.server.pricing.model.PriceAcceptance;
import org.adseller.server.pricing.model.PricingResult;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.collections4.ListUtils;
import org.apache.commons.lang3.ObjectUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Turns pricing and audience results of a proposal into an outcome.
 * <p>
 * Rules are checked in a fixed order and the first one that fires wins:
 * <ol>
 * <li>unfulfillable audience (no match, no alternatives) rejects;</li>
 * <li>an offer below the enforced floor is countered at the floor;</li>
 * <li>a partially covered audience is countered at the original terms with gaps and alternatives listed;</li>
 * <li>anything else is accepted.</li>
 * </ol>
 * Each rule can be switched off per inventory channel by {@link DecisionPolicy}. An accepted draft still has to
 * reserve inventory before it becomes final.
 */
public class DecisionMaker {

    private final PricingEngine pricingEngine;

    public DecisionMaker(PricingEngine pricingEngine) {
        this.pricingEngine = Objects.requireNonNull(pricingEngine);
    }

    public Decision decide(Proposal proposal,
                           DecisionPolicy policy,
                           PricingResult pricingResult,
                           CoverageResult coverageResult) {

        final ValidationStatus status = coverageResult != null
                ? coverageResult.getValidationStatus()
                : ValidationStatus.not_requested;
        final List<String> alternatives = coverageResult != null
                ? ListUtils.emptyIfNull(coverageResult.getAlternatives())
                : Collections.emptyList();

        final Decision.DecisionBuilder decision = Decision.builder()
                .proposalId(proposal.getId())
                .pricingResult(pricingResult)
                .coverageResult(coverageResult);

        if (policy.isRejectUnfulfillableAudience()
                && status == ValidationStatus.no_match
                && alternatives.isEmpty()) {

            return decision
                    .outcome(DecisionOutcome.rejected)
                    .reasons(List.of("Audience unfulfillable: no capability matches the requested audience"))
                    .build();
        }

        final BigDecimal proposedPrice = proposal.getProposedPrice();
        if (policy.isCounterBelowFloor() && pricingResult.isFlooredApplied() && proposedPrice != null) {
            final PriceAcceptance acceptance = pricingEngine.isPriceAcceptable(
                    proposedPrice, pricingResult.getFloorPrice());
            if (!acceptance.isAcceptable()) {
                final BigDecimal floorPrice = pricingResult.getFinalPrice();
                return decision
                        .outcome(DecisionOutcome.countered)
                        .reasons(List.of(acceptance.getReason()))
                        .counterTerms(CounterTerms.of(floorPrice, proposal.getVolume(),
                                "Proposed price %s CPM is below the floor, minimum is %s CPM"
                                        .formatted(money(proposedPrice), money(floorPrice))))
                        .build();
            }
        }

        final boolean audienceShort = status == ValidationStatus.partial_match || status == ValidationStatus.no_match;
        if (policy.isCounterPartialMatch() && audienceShort) {
            return decision
                    .outcome(DecisionOutcome.countered)
                    .reasons(List.of("Audience partially covered (%s)".formatted(status)))
                    .counterTerms(CounterTerms.of(
                            ObjectUtils.defaultIfNull(proposedPrice, pricingResult.getFinalPrice()),
                            proposal.getVolume(),
                            audienceNote(coverageResult)))
                    .build();
        }

        final List<String> reasons = new ArrayList<>();
        reasons.add("Price %s CPM accepted".formatted(money(pricingResult.getFinalPrice())));
        if (status != ValidationStatus.not_requested) {
            reasons.add("Audience validation: " + status);
        }
        return decision
                .outcome(DecisionOutcome.accepted)
                .reasons(List.copyOf(reasons))
                .build();
    }

    private static String audienceNote(CoverageResult coverageResult) {
        final List<String> gaps = coverageResult.getGaps();
        final List<String> alternatives = coverageResult.getAlternatives();

        final StringBuilder note = new StringBuilder("Audience gaps: ")
                .append(CollectionUtils.isEmpty(gaps) ? "none" : String.join(", ", gaps));
        if (CollectionUtils.isNotEmpty(alternatives)) {
            note.append("; suggested alternatives: ").append(String.join(", ", alternatives));
        }
        return note.toString();
    }

    private static String money(BigDecimal value) {
        return "$" + value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
