package org.adseller.server.deals.model;

import lombok.Builder;
import lombok.Value;
import org.adseller.server.audience.model.CoverageResult;
import org.adseller.server.pricing.model.PricingResult;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class Decision {

    String proposalId;

    DecisionOutcome outcome;

    @Builder.Default
    List<String> reasons = Collections.emptyList();

    /**
     * Present for accepted proposals only.
     */
    String dealId;

    CounterTerms counterTerms;

    PricingResult pricingResult;

    CoverageResult coverageResult;

    @Builder.Default
    List<UpsellSuggestion> upsellSuggestions = Collections.emptyList();

    Instant decidedAt;
}
