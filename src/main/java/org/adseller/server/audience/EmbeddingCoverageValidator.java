package org.adseller.server.audience;

import org.adseller.server.audience.model.AudienceCapability;
import org.adseller.server.audience.model.AudienceEmbedding;
import org.adseller.server.audience.model.AudienceRequest;
import org.adseller.server.audience.model.AudienceThresholds;
import org.adseller.server.audience.model.CoverageResult;
import org.adseller.server.audience.model.RequestedCapability;
import org.adseller.server.audience.model.ValidationStatus;
import org.adseller.server.exception.ConfigurationException;
import org.adseller.server.exception.DimensionMismatchException;
import org.adseller.server.exception.InvalidEmbeddingException;
import org.apache.commons.collections4.ListUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link CoverageValidator} based on cosine similarity of audience embeddings.
 * <p>
 * Similarity uses best-match semantics: the score is the highest similarity across all published capabilities.
 * Coverage is computed separately from the requested tags and their weights, so it tells how much of the
 * buyer's ask can be served regardless of how close the embeddings are.
 */
public class EmbeddingCoverageValidator implements CoverageValidator {

    private static final double FULL_COVERAGE = 100.0d;

    private final AudienceThresholds thresholds;

    public EmbeddingCoverageValidator(AudienceThresholds thresholds) {
        this.thresholds = validateThresholds(thresholds);
    }

    private static AudienceThresholds validateThresholds(AudienceThresholds thresholds) {
        if (thresholds == null) {
            throw new ConfigurationException("Audience thresholds must be present");
        }

        validateSimilarity(thresholds.getValidSimilarity(), "valid-similarity");
        validateSimilarity(thresholds.getMinimumSimilarity(), "minimum-similarity");
        validateSimilarity(thresholds.getTagMatchThreshold(), "tag-match-threshold");

        if (thresholds.getMinimumSimilarity() > thresholds.getValidSimilarity()) {
            throw new ConfigurationException("Audience minimum-similarity %s must not exceed valid-similarity %s"
                    .formatted(thresholds.getMinimumSimilarity(), thresholds.getValidSimilarity()));
        }
        if (thresholds.getMaxAlternativesPerGap() < 0) {
            throw new ConfigurationException("Audience max-alternatives-per-gap must be non-negative, but was "
                    + thresholds.getMaxAlternativesPerGap());
        }
        return thresholds;
    }

    private static void validateSimilarity(double value, String name) {
        if (value < 0.0d || value > 1.0d) {
            throw new ConfigurationException("Audience %s must be in range [0, 1], but was %s".formatted(name, value));
        }
    }

    @Override
    public CoverageResult validate(AudienceRequest request, List<AudienceCapability> capabilities) {
        final AudienceEmbedding buyerEmbedding = request != null ? request.getEmbedding() : null;
        if (buyerEmbedding == null) {
            throw new InvalidEmbeddingException("Buyer embedding must be present");
        }

        final List<AudienceCapability> sellerCapabilities = ListUtils.emptyIfNull(capabilities).stream()
                .filter(Objects::nonNull)
                .toList();
        for (AudienceCapability capability : sellerCapabilities) {
            final int sellerDimension = capability.getEmbedding().getDimension();
            if (sellerDimension != buyerEmbedding.getDimension()) {
                throw new DimensionMismatchException(buyerEmbedding.getDimension(), sellerDimension);
            }
        }

        final float[] buyerVector = buyerEmbedding.getVector();
        final Map<String, Double> similarityByTag = new LinkedHashMap<>();
        for (AudienceCapability capability : sellerCapabilities) {
            final double similarity = CosineSimilarity.similarity(buyerVector, capability.getEmbedding().getVector());
            similarityByTag.merge(capability.getTag(), similarity, Math::max);
        }
        final double similarityScore = similarityByTag.values().stream()
                .mapToDouble(Double::doubleValue)
                .max()
                .orElse(0.0d);

        final List<RequestedCapability> requested = ListUtils.emptyIfNull(request.getRequestedCapabilities());
        final List<String> matched = new ArrayList<>();
        final List<String> gaps = new ArrayList<>();
        double totalWeight = 0.0d;
        double matchedWeight = 0.0d;
        for (RequestedCapability capability : requested) {
            final double weight = Math.max(capability.getWeight(), 0.0d);
            totalWeight += weight;

            final Double similarity = similarityByTag.get(capability.getTag());
            if (similarity != null && similarity > 0.0d && similarity >= thresholds.getTagMatchThreshold()) {
                matchedWeight += weight;
                matched.add(capability.getTag());
            } else {
                gaps.add(capability.getTag());
            }
        }

        final boolean fullCoverage = gaps.isEmpty();
        final double coveragePercentage = totalWeight > 0.0d
                ? Math.min(FULL_COVERAGE, matchedWeight / totalWeight * FULL_COVERAGE)
                : FULL_COVERAGE;

        final ValidationStatus status = classify(
                similarityScore, fullCoverage, !requested.isEmpty() && matchedWeight == 0.0d);

        final Set<String> requestedTags = requested.stream()
                .map(RequestedCapability::getTag)
                .collect(Collectors.toSet());

        return CoverageResult.builder()
                .validationStatus(status)
                .coveragePercentage(coveragePercentage)
                .similarityScore(similarityScore)
                .matchedCapabilities(List.copyOf(matched))
                .gaps(List.copyOf(gaps))
                .alternatives(alternatives(gaps, buyerVector, sellerCapabilities, requestedTags))
                .notes(List.of(
                        String.format(Locale.ROOT, "Similarity: %.2f", similarityScore),
                        String.format(Locale.ROOT, "Coverage: %.1f%%", coveragePercentage),
                        "Matched %d of %d requested capabilities".formatted(matched.size(), requested.size())))
                .build();
    }

    private ValidationStatus classify(double similarity, boolean fullCoverage, boolean nothingMatched) {
        if (similarity < thresholds.getMinimumSimilarity() || nothingMatched) {
            return ValidationStatus.no_match;
        }
        if (similarity >= thresholds.getValidSimilarity() && fullCoverage) {
            return ValidationStatus.valid;
        }
        return ValidationStatus.partial_match;
    }

    /**
     * Suggests seller capabilities closest to each gap. A gap the seller publishes (but below threshold) is
     * compared by its own embedding, an unknown gap by the buyer embedding. Requested tags are never suggested.
     */
    private List<String> alternatives(List<String> gaps,
                                      float[] buyerVector,
                                      List<AudienceCapability> capabilities,
                                      Set<String> requestedTags) {

        if (gaps.isEmpty() || thresholds.getMaxAlternativesPerGap() == 0) {
            return Collections.emptyList();
        }

        final Map<String, Double> bestScoreByTag = new HashMap<>();
        for (String gap : gaps) {
            final float[] reference = capabilities.stream()
                    .filter(capability -> gap.equals(capability.getTag()))
                    .findFirst()
                    .map(capability -> capability.getEmbedding().getVector())
                    .orElse(buyerVector);

            final Map<String, Double> candidates = new HashMap<>();
            for (AudienceCapability capability : capabilities) {
                if (requestedTags.contains(capability.getTag())) {
                    continue;
                }
                final double score = CosineSimilarity.similarity(reference, capability.getEmbedding().getVector());
                if (score >= thresholds.getMinimumSimilarity()) {
                    candidates.merge(capability.getTag(), score, Math::max);
                }
            }

            candidates.entrySet().stream()
                    .sorted(byScoreThenTag())
                    .limit(thresholds.getMaxAlternativesPerGap())
                    .forEach(entry -> bestScoreByTag.merge(entry.getKey(), entry.getValue(), Math::max));
        }

        return bestScoreByTag.entrySet().stream()
                .sorted(byScoreThenTag())
                .map(Map.Entry::getKey)
                .toList();
    }

    private static Comparator<Map.Entry<String, Double>> byScoreThenTag() {
        return Map.Entry.<String, Double>comparingByValue().reversed()
                .thenComparing(Map.Entry.comparingByKey());
    }
}
