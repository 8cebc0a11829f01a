package org.adseller.server.deals.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class UpsellSuggestion {

    UpsellType type;

    String productId;

    /**
     * Impressions to book, present for volume upgrades only.
     */
    Long volume;

    String message;
}
