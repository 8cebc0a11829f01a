package org.adseller.server.identity;

import lombok.Builder;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

@Value
@Builder(toBuilder = true)
public class BuyerContext {

    BuyerIdentity identity;

    boolean authenticated;

    /**
     * oauth, api_key or a2a; informational only.
     */
    String authenticationMethod;

    public static BuyerContext unauthenticated(BuyerIdentity identity) {
        return BuyerContext.builder().identity(identity).authenticated(false).build();
    }

    public static BuyerContext authenticated(BuyerIdentity identity) {
        return BuyerContext.builder().identity(identity).authenticated(true).build();
    }

    /**
     * Returns the most specific identifier of the buyer, so the same advertiser gets consistent pricing across
     * agencies.
     */
    public String pricingKey() {
        if (identity == null) {
            return "public";
        }
        if (StringUtils.isNotBlank(identity.getAdvertiserId())) {
            return "advertiser:" + identity.getAdvertiserId();
        }
        if (StringUtils.isNotBlank(identity.getAgencyId())) {
            return "agency:" + identity.getAgencyId();
        }
        if (StringUtils.isNotBlank(identity.getSeatId())) {
            return "seat:" + identity.getSeatId();
        }
        return "public";
    }
}
