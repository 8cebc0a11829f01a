package org.adseller.server.deals;

import org.adseller.server.audience.model.AudienceEmbedding;
import org.adseller.server.audience.model.AudienceRequest;
import org.adseller.server.audience.model.EmbeddingType;
import org.adseller.server.audience.model.RequestedCapability;
import org.adseller.server.deals.model.Decision;
import org.adseller.server.deals.model.DecisionOutcome;
import org.adseller.server.deals.model.Proposal;
import org.adseller.server.deals.model.UpsellSuggestion;
import org.adseller.server.deals.model.UpsellType;
import org.adseller.server.identity.BuyerContext;
import org.adseller.server.identity.BuyerIdentity;
import org.adseller.server.pricing.PricingEngine;
import org.adseller.server.pricing.model.VolumeBreakpoint;
import org.adseller.server.settings.model.Product;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
public class UpsellAdvisorTest {

    private static final Product CTV_SPORTS = givenProduct("ctv-sports", "ctv", Set.of("sports", "auto_intenders"));
    private static final Product CTV_NEWS = givenProduct("ctv-news", "ctv", Set.of("news"));
    private static final Product DISPLAY_SPORTS = givenProduct("display-sports", "display", Set.of("sports"));
    private static final Product DISPLAY_FINANCE = givenProduct("display-finance", "display", Set.of("finance"));
    private static final Product VIDEO_AUTO = givenProduct("video-auto", "video", Set.of("auto_intenders", "sports"));

    private static final List<Product> CATALOG = List.of(
            CTV_SPORTS, CTV_NEWS, DISPLAY_SPORTS, DISPLAY_FINANCE, VIDEO_AUTO);

    @Mock
    private PricingEngine pricingEngine;

    private UpsellAdvisor target;

    @BeforeEach
    public void setUp() {
        target = new UpsellAdvisor(pricingEngine, 2);
    }

    @Test
    public void creationShouldFailOnNegativeLimit() {
        assertThatIllegalArgumentException().isThrownBy(() -> new UpsellAdvisor(pricingEngine, -1));
    }

    @Test
    public void suggestShouldOfferProductsPublishingRequestedCapabilitiesForRejectedProposal() {
        // given
        final Proposal proposal = givenProposal(List.of("sports", "auto_intenders"));

        // when
        final List<UpsellSuggestion> result = target.suggest(
                proposal, CTV_NEWS, givenDecision(DecisionOutcome.rejected), CATALOG);

        // then
        assertThat(result)
                .extracting(UpsellSuggestion::getType, UpsellSuggestion::getProductId, UpsellSuggestion::getMessage)
                .containsExactly(
                        tuple(UpsellType.alternative_product, "ctv-sports",
                                "Consider Product ctv-sports (ctv-sports), it publishes auto_intenders, sports"),
                        tuple(UpsellType.alternative_product, "video-auto",
                                "Consider Product video-auto (video-auto), it publishes auto_intenders, sports"));
        verifyNoInteractions(pricingEngine);
    }

    @Test
    public void suggestShouldOfferSameInventoryTypeForRejectedUntargetedProposal() {
        // when
        final List<UpsellSuggestion> result = target.suggest(
                givenProposal(null), DISPLAY_SPORTS, givenDecision(DecisionOutcome.rejected), CATALOG);

        // then
        assertThat(result)
                .extracting(UpsellSuggestion::getType, UpsellSuggestion::getProductId)
                .containsExactly(tuple(UpsellType.alternative_product, "display-finance"));
    }

    @Test
    public void suggestShouldOfferVolumeUpgradeAndCrossSellsForAcceptedProposal() {
        // given
        given(pricingEngine.nextVolumeBreakpoint(any(), anyLong()))
                .willReturn(Optional.of(VolumeBreakpoint.of(5_000_000L, new BigDecimal("0.05"))));

        // when
        final List<UpsellSuggestion> result = target.suggest(
                givenProposal(List.of("sports")), CTV_SPORTS, givenDecision(DecisionOutcome.accepted), CATALOG);

        // then
        assertThat(result)
                .extracting(UpsellSuggestion::getType, UpsellSuggestion::getProductId, UpsellSuggestion::getVolume)
                .containsExactly(
                        tuple(UpsellType.volume_upgrade, "ctv-sports", 5_000_000L),
                        tuple(UpsellType.cross_sell, "display-sports", null),
                        tuple(UpsellType.cross_sell, "video-auto", null));
        assertThat(result.get(0).getMessage()).isEqualTo("Book 5000000 impressions for a 5% volume discount");
        assertThat(result.get(1).getMessage())
                .isEqualTo("Extend the campaign to display inventory with Product display-sports (display-sports)");
    }

    @Test
    public void suggestShouldRankCrossSellsByProductCapabilitiesWhenNothingIsRequested() {
        // given
        given(pricingEngine.nextVolumeBreakpoint(any(), anyLong())).willReturn(Optional.empty());

        // when
        final List<UpsellSuggestion> result = target.suggest(
                givenProposal(null), CTV_SPORTS, givenDecision(DecisionOutcome.countered), CATALOG);

        // then
        assertThat(result)
                .extracting(UpsellSuggestion::getType, UpsellSuggestion::getProductId)
                .containsExactly(
                        tuple(UpsellType.cross_sell, "video-auto"),
                        tuple(UpsellType.cross_sell, "display-sports"));
    }

    @Test
    public void suggestShouldReturnOnlyVolumeUpgradeWhenProductSuggestionsAreDisabled() {
        // given
        target = new UpsellAdvisor(pricingEngine, 0);
        given(pricingEngine.nextVolumeBreakpoint(any(), anyLong()))
                .willReturn(Optional.of(VolumeBreakpoint.of(10_000_000L, new BigDecimal("0.10"))));

        // when
        final List<UpsellSuggestion> result = target.suggest(
                givenProposal(null), CTV_SPORTS, givenDecision(DecisionOutcome.accepted), CATALOG);

        // then
        assertThat(result).extracting(UpsellSuggestion::getType).containsExactly(UpsellType.volume_upgrade);
    }

    @Test
    public void suggestShouldReturnNothingForEmptyCatalogAndLargestVolume() {
        // given
        given(pricingEngine.nextVolumeBreakpoint(any(), anyLong())).willReturn(Optional.empty());

        // when
        final List<UpsellSuggestion> result = target.suggest(
                givenProposal(null), CTV_SPORTS, givenDecision(DecisionOutcome.accepted), null);

        // then
        assertThat(result).isEmpty();
    }

    private static Decision givenDecision(DecisionOutcome outcome) {
        return Decision.builder().proposalId("proposal-1").outcome(outcome).build();
    }

    private static Proposal givenProposal(List<String> requestedTags) {
        return Proposal.builder()
                .id("proposal-1")
                .buyerContext(BuyerContext.authenticated(BuyerIdentity.builder().advertiserId("adv-1").build()))
                .productId("any")
                .volume(1_000_000L)
                .audienceRequest(requestedTags != null
                        ? AudienceRequest.of(
                                AudienceEmbedding.of(EmbeddingType.user_intent, new float[256]),
                                requestedTags.stream().map(RequestedCapability::of).toList())
                        : null)
                .build();
    }

    private static Product givenProduct(String id, String inventoryType, Set<String> capabilityTags) {
        return Product.builder()
                .id(id)
                .name("Product " + id)
                .baseCpm(new BigDecimal("20.00"))
                .inventoryType(inventoryType)
                .capabilityTags(capabilityTags)
                .build();
    }
}
