package org.adseller.server.audience.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;

@Value
@Builder
public class CoverageResult {

    ValidationStatus validationStatus;

    /**
     * Share of the requested capability weight the seller can serve, in [0, 100].
     */
    double coveragePercentage;

    /**
     * Best cosine similarity between the buyer embedding and seller capabilities, in [0, 1].
     */
    double similarityScore;

    @Builder.Default
    List<String> matchedCapabilities = Collections.emptyList();

    @Builder.Default
    List<String> gaps = Collections.emptyList();

    @Builder.Default
    List<String> alternatives = Collections.emptyList();

    @Builder.Default
    List<String> notes = Collections.emptyList();

    public static CoverageResult notRequested(String note) {
        return CoverageResult.builder()
                .validationStatus(ValidationStatus.not_requested)
                .notes(note != null ? Collections.singletonList(note) : Collections.emptyList())
                .build();
    }
}
