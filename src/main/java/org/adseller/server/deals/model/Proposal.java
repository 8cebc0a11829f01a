package org.adseller.server.deals.model;

import lombok.Builder;
import lombok.Value;
import org.adseller.server.audience.model.AudienceRequest;
import org.adseller.server.identity.BuyerContext;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class Proposal {

    String id;

    BuyerContext buyerContext;

    String productId;

    /**
     * Requested impressions.
     */
    long volume;

    /**
     * Buyer targeting, absent when the buyer does not ask for audience validation.
     */
    AudienceRequest audienceRequest;

    /**
     * CPM the buyer offers, absent when the buyer takes the seller's price.
     */
    BigDecimal proposedPrice;

    Instant submittedAt;
}
