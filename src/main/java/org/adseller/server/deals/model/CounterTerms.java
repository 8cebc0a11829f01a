package org.adseller.server.deals.model;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Terms the seller is willing to accept instead of the proposed ones.
 */
@Value(staticConstructor = "of")
public class CounterTerms {

    BigDecimal price;

    long volume;

    String note;
}
