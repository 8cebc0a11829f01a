package org.adseller.server.audience.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class AudienceThresholds {

    /**
     * Similarity required, together with full capability coverage, for a valid match.
     */
    @Builder.Default
    double validSimilarity = 0.5d;

    /**
     * Similarity below which nothing is considered a match.
     */
    @Builder.Default
    double minimumSimilarity = 0.3d;

    /**
     * Similarity a published capability needs to satisfy a requested tag.
     */
    @Builder.Default
    double tagMatchThreshold = 0.3d;

    @Builder.Default
    int maxAlternativesPerGap = 2;

    public static AudienceThresholds defaults() {
        return AudienceThresholds.builder().build();
    }
}
