package org.adseller.server.audience;

import org.adseller.server.audience.model.AudienceCapability;
import org.adseller.server.audience.model.AudienceRequest;
import org.adseller.server.audience.model.CoverageResult;

import java.util.List;

/**
 * Scores a buyer's audience request against the capabilities a seller publishes for a product.
 */
public interface CoverageValidator {

    /**
     * Returns a fresh {@link CoverageResult}.
     *
     * @throws org.adseller.server.exception.DimensionMismatchException if any capability embedding differs in
     *                                                                  dimension from the buyer embedding
     */
    CoverageResult validate(AudienceRequest request, List<AudienceCapability> capabilities);
}
