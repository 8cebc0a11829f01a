package org.adseller.server.pricing.model;

import lombok.Builder;
import lombok.Value;
import org.adseller.server.identity.BuyerIdentity;
import org.adseller.server.identity.Tier;
import org.apache.commons.collections4.CollectionUtils;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Set;

/**
 * Seller-defined pricing exception for a subset of buyers or products. Empty criteria match everything.
 */
@Value
@Builder(toBuilder = true)
public class PricingRule {

    String ruleId;

    String ruleName;

    int priority;

    Tier tier;

    Set<String> agencyIds;

    Set<String> advertiserIds;

    Set<String> holdingCompanyIds;

    Set<String> productIds;

    Set<String> inventoryTypes;

    @Builder.Default
    BigDecimal discount = BigDecimal.ZERO;

    BigDecimal priceOverride;

    @Builder.Default
    boolean active = true;

    public boolean matches(Tier buyerTier, BuyerIdentity identity, String productId, String inventoryType) {
        if (tier != null && tier != buyerTier) {
            return false;
        }

        final String agencyId = identity != null ? identity.getAgencyId() : null;
        final String advertiserId = identity != null ? identity.getAdvertiserId() : null;
        final String holdingCompany = identity != null ? identity.getAgencyHoldingCompany() : null;

        return matchesCriteria(agencyIds, agencyId)
                && matchesCriteria(advertiserIds, advertiserId)
                && matchesCriteria(holdingCompanyIds, holdingCompany)
                && matchesCriteria(productIds, productId)
                && matchesCriteria(inventoryTypes, inventoryType);
    }

    private static boolean matchesCriteria(Collection<String> allowed, String value) {
        return CollectionUtils.isEmpty(allowed) || (value != null && allowed.contains(value));
    }
}
