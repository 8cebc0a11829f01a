package org.adseller.server.identity;

import org.apache.commons.lang3.StringUtils;

import java.util.EnumSet;
import java.util.Set;

/**
 * Resolves the pricing {@link Tier} of a buyer.
 * <p>
 * Authentication is required for anything above {@link Tier#PUBLIC}: an unauthenticated context is public
 * regardless of the identity fields it carries.
 */
public class BuyerTierResolver {

    private static final Set<Tier> NEGOTIATION_TIERS = EnumSet.of(Tier.AGENCY, Tier.ADVERTISER);

    public Tier resolveTier(BuyerContext context) {
        if (context == null || !context.isAuthenticated() || context.getIdentity() == null) {
            return Tier.PUBLIC;
        }

        final BuyerIdentity identity = context.getIdentity();
        if (StringUtils.isNotBlank(identity.getAdvertiserId())) {
            return Tier.ADVERTISER;
        }
        if (StringUtils.isNotBlank(identity.getAgencyId())) {
            return Tier.AGENCY;
        }
        if (StringUtils.isNotBlank(identity.getSeatId())) {
            return Tier.SEAT;
        }
        return Tier.PUBLIC;
    }

    public boolean isEligibleForNegotiation(BuyerContext context) {
        return NEGOTIATION_TIERS.contains(resolveTier(context));
    }

    public boolean isEligibleForPremiumInventory(BuyerContext context) {
        return resolveTier(context) != Tier.PUBLIC;
    }
}
