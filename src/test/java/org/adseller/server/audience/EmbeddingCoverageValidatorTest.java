package org.adseller.server.audience;

import org.adseller.server.audience.model.AudienceCapability;
import org.adseller.server.audience.model.AudienceEmbedding;
import org.adseller.server.audience.model.AudienceRequest;
import org.adseller.server.audience.model.AudienceThresholds;
import org.adseller.server.audience.model.CoverageResult;
import org.adseller.server.audience.model.EmbeddingType;
import org.adseller.server.audience.model.RequestedCapability;
import org.adseller.server.audience.model.ValidationStatus;
import org.adseller.server.exception.ConfigurationException;
import org.adseller.server.exception.DimensionMismatchException;
import org.adseller.server.exception.InvalidEmbeddingException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class EmbeddingCoverageValidatorTest {

    private static final int DIMENSION = 256;

    private final EmbeddingCoverageValidator target = new EmbeddingCoverageValidator(AudienceThresholds.defaults());

    @Test
    public void creationShouldFailWhenMinimumSimilarityExceedsValidSimilarity() {
        assertThatThrownBy(() -> new EmbeddingCoverageValidator(AudienceThresholds.builder()
                .validSimilarity(0.2d)
                .minimumSimilarity(0.3d)
                .build()))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    public void creationShouldFailOnSimilarityOutOfRange() {
        assertThatThrownBy(() -> new EmbeddingCoverageValidator(AudienceThresholds.builder()
                .tagMatchThreshold(1.5d)
                .build()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("Audience tag-match-threshold must be in range [0, 1], but was 1.5");
    }

    @Test
    public void validateShouldFailOnDimensionMismatch() {
        // given
        final AudienceRequest request = AudienceRequest.of(
                AudienceEmbedding.of(EmbeddingType.user_intent, new float[300]), List.of());
        final List<AudienceCapability> capabilities = List.of(
                AudienceCapability.of("sports", AudienceEmbedding.of(EmbeddingType.inventory, new float[512])));

        // when and then
        assertThatThrownBy(() -> target.validate(request, capabilities))
                .isInstanceOfSatisfying(DimensionMismatchException.class, exception -> {
                    assertThat(exception.getBuyerDimension()).isEqualTo(300);
                    assertThat(exception.getSellerDimension()).isEqualTo(512);
                });
    }

    @Test
    public void validateShouldFailWithoutBuyerEmbedding() {
        assertThatThrownBy(() -> target.validate(AudienceRequest.of(null, List.of()), List.of()))
                .isInstanceOf(InvalidEmbeddingException.class);
    }

    @Test
    public void validateShouldReturnValidWhenAllRequestedCapabilitiesMatch() {
        // given
        final AudienceRequest request = givenRequest(givenEmbedding(0), RequestedCapability.of("sports"));

        // when
        final CoverageResult result = target.validate(request, givenCapabilities());

        // then
        assertThat(result.getValidationStatus()).isEqualTo(ValidationStatus.valid);
        assertThat(result.getSimilarityScore()).isCloseTo(1.0d, within(1e-6));
        assertThat(result.getCoveragePercentage()).isEqualTo(100.0d);
        assertThat(result.getMatchedCapabilities()).containsExactly("sports");
        assertThat(result.getGaps()).isEmpty();
        assertThat(result.getAlternatives()).isEmpty();
    }

    @Test
    public void validateShouldReturnValidWhenNothingSpecificIsRequested() {
        // given
        final AudienceRequest request = AudienceRequest.of(givenEmbedding(1), List.of());

        // when
        final CoverageResult result = target.validate(request, givenCapabilities());

        // then
        assertThat(result.getValidationStatus()).isEqualTo(ValidationStatus.valid);
        assertThat(result.getCoveragePercentage()).isEqualTo(100.0d);
    }

    @Test
    public void validateShouldReturnPartialMatchWithGapsAndAlternatives() {
        // given
        final AudienceRequest request = givenRequest(givenEmbedding(0),
                RequestedCapability.of("sports"),
                RequestedCapability.of("finance"));

        // when
        final CoverageResult result = target.validate(request, givenCapabilities());

        // then
        assertThat(result.getValidationStatus()).isEqualTo(ValidationStatus.partial_match);
        assertThat(result.getCoveragePercentage()).isEqualTo(50.0d);
        assertThat(result.getMatchedCapabilities()).containsExactly("sports");
        assertThat(result.getGaps()).containsExactly("finance");
        assertThat(result.getAlternatives()).containsExactly("auto_intenders");
    }

    @Test
    public void validateShouldReturnUnmodifiableLists() {
        // given
        final AudienceRequest request = givenRequest(givenEmbedding(0),
                RequestedCapability.of("sports"),
                RequestedCapability.of("finance"));

        // when
        final CoverageResult result = target.validate(request, givenCapabilities());

        // then
        assertThatThrownBy(() -> result.getGaps().clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> result.getMatchedCapabilities().add("news"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> result.getAlternatives().add("news"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    public void validateShouldWeighCoverageByRequestedWeights() {
        // given
        final AudienceRequest request = givenRequest(givenEmbedding(0),
                RequestedCapability.of("sports", 3.0d),
                RequestedCapability.of("finance", 1.0d));

        // when
        final CoverageResult result = target.validate(request, givenCapabilities());

        // then
        assertThat(result.getCoveragePercentage()).isEqualTo(75.0d);
    }

    @Test
    public void validateShouldReturnNoMatchWithoutAlternativesForUnrelatedAudience() {
        // given
        final AudienceRequest request = givenRequest(givenEmbedding(7), RequestedCapability.of("news"));
        final List<AudienceCapability> capabilities = List.of(
                AudienceCapability.of("sports", givenEmbedding(0)),
                AudienceCapability.of("news", givenEmbedding(1)));

        // when
        final CoverageResult result = target.validate(request, capabilities);

        // then
        assertThat(result.getValidationStatus()).isEqualTo(ValidationStatus.no_match);
        assertThat(result.getSimilarityScore()).isZero();
        assertThat(result.getCoveragePercentage()).isZero();
        assertThat(result.getGaps()).containsExactly("news");
        assertThat(result.getAlternatives()).isEmpty();
    }

    @Test
    public void validateShouldSuggestAlternativesCloseToUnmatchedPublishedCapability() {
        // given
        final AudienceRequest request = givenRequest(givenEmbedding(7), RequestedCapability.of("sports"));

        // when
        final CoverageResult result = target.validate(request, givenCapabilities());

        // then
        assertThat(result.getValidationStatus()).isEqualTo(ValidationStatus.no_match);
        assertThat(result.getGaps()).containsExactly("sports");
        assertThat(result.getAlternatives()).containsExactly("auto_intenders");
    }

    @Test
    public void validateShouldLimitAlternativesPerGap() {
        // given
        final EmbeddingCoverageValidator limited = new EmbeddingCoverageValidator(AudienceThresholds.builder()
                .maxAlternativesPerGap(1)
                .build());
        final AudienceRequest request = givenRequest(givenEmbedding(0), RequestedCapability.of("finance"));
        final List<AudienceCapability> capabilities = List.of(
                AudienceCapability.of("close", givenEmbedding(0, 1.0F, 1, 0.2F)),
                AudienceCapability.of("closer", givenEmbedding(0, 1.0F, 1, 0.1F)));

        // when
        final CoverageResult result = limited.validate(request, capabilities);

        // then
        assertThat(result.getAlternatives()).containsExactly("closer");
    }

    @Test
    public void validateShouldKeepScoresWithinBounds() {
        // given
        final AudienceRequest request = givenRequest(givenEmbedding(0, -1.0F, 1, 0.5F),
                RequestedCapability.of("sports", 0.0d));

        // when
        final CoverageResult result = target.validate(request, givenCapabilities());

        // then
        assertThat(result.getSimilarityScore()).isBetween(0.0d, 1.0d);
        assertThat(result.getCoveragePercentage()).isBetween(0.0d, 100.0d);
    }

    private static List<AudienceCapability> givenCapabilities() {
        return List.of(
                AudienceCapability.of("sports", givenEmbedding(0)),
                AudienceCapability.of("news", givenEmbedding(1)),
                AudienceCapability.of("auto_intenders", givenEmbedding(0, 1.0F, 2, 1.0F)));
    }

    private static AudienceRequest givenRequest(AudienceEmbedding embedding, RequestedCapability... capabilities) {
        return AudienceRequest.of(embedding, List.of(capabilities));
    }

    private static AudienceEmbedding givenEmbedding(int index) {
        return givenEmbedding(index, 1.0F, index, 1.0F);
    }

    private static AudienceEmbedding givenEmbedding(int firstIndex, float firstValue,
                                                    int secondIndex, float secondValue) {

        final float[] vector = new float[DIMENSION];
        vector[firstIndex] = firstValue;
        vector[secondIndex] = secondValue;
        return AudienceEmbedding.of(EmbeddingType.user_intent, vector);
    }
}
