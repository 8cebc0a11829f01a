package org.adseller.server.identity;

import lombok.Builder;
import lombok.Value;

/**
 * Identity revealed by a buyer. Revealing more of it (seat, then agency, then advertiser) unlocks better
 * pricing once the buyer is authenticated.
 */
@Value
@Builder(toBuilder = true)
public class BuyerIdentity {

    private static final BuyerIdentity ANONYMOUS = BuyerIdentity.builder().build();

    String seatId;

    String seatName;

    /**
     * DSP platform of the seat, e.g. ttd, dv360.
     */
    String dspPlatform;

    String agencyId;

    String agencyName;

    String agencyHoldingCompany;

    String advertiserId;

    String advertiserName;

    String advertiserIndustry;

    String campaignId;

    public static BuyerIdentity anonymous() {
        return ANONYMOUS;
    }
}
