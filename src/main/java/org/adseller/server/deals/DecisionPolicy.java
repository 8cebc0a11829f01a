package org.adseller.server.deals;

import lombok.Builder;
import lombok.Value;

/**
 * Negotiation behavior of a single inventory channel.
 */
@Value
@Builder(toBuilder = true)
public class DecisionPolicy {

    /**
     * Reject proposals whose audience cannot be matched and for which no alternative exists.
     */
    @Builder.Default
    boolean rejectUnfulfillableAudience = true;

    /**
     * Counter at the floor price when the buyer offers less than the floor.
     */
    @Builder.Default
    boolean counterBelowFloor = true;

    /**
     * Counter proposals whose audience is only partially covered.
     */
    @Builder.Default
    boolean counterPartialMatch = true;

    public static DecisionPolicy defaults() {
        return DecisionPolicy.builder().build();
    }
}
