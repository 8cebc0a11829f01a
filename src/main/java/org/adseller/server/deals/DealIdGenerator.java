package org.adseller.server.deals;

import java.time.Instant;

/**
 * Generates identifiers of accepted deals.
 */
public interface DealIdGenerator {

    String generate(String sellerOrgId, String productId, Instant proposalTimestamp);
}
