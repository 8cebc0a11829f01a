package org.adseller.server.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.adseller.server.audience.model.ValidationStatus;
import org.adseller.server.deals.model.DecisionOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

public class MetricsTest {

    private MeterRegistry meterRegistry;

    private Metrics metrics;

    @BeforeEach
    public void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new Metrics(meterRegistry);
    }

    @Test
    public void updateDecisionMetricsShouldCountOutcomeByInventoryType() {
        // when
        metrics.updateDecisionMetrics(DecisionOutcome.accepted, "ctv", 12L);
        metrics.updateDecisionMetrics(DecisionOutcome.accepted, "ctv", 8L);
        metrics.updateDecisionMetrics(DecisionOutcome.countered, null, 5L);

        // then
        assertThat(meterRegistry.counter("deal_desk.decisions.accepted", "inventory_type", "ctv").count())
                .isEqualTo(2.0d);
        assertThat(meterRegistry.counter("deal_desk.decisions.countered", "inventory_type", "unknown").count())
                .isEqualTo(1.0d);
        assertThat(meterRegistry.timer("deal_desk.proposals.decision_time").count()).isEqualTo(3L);
        assertThat(meterRegistry.timer("deal_desk.proposals.decision_time").totalTime(TimeUnit.MILLISECONDS))
                .isEqualTo(25.0d);
    }

    @Test
    public void updateAudienceValidationMetricShouldTagStatus() {
        // when
        metrics.updateAudienceValidationMetric(ValidationStatus.partial_match);

        // then
        assertThat(meterRegistry.counter("deal_desk.audience.validations", "status", "partial_match").count())
                .isEqualTo(1.0d);
    }

    @Test
    public void shouldIncrementPlainCounters() {
        // when
        metrics.updateProposalSubmittedMetric();
        metrics.updateProposalSubmittedMetric();
        metrics.updateProposalInvalidMetric();
        metrics.updateProposalWithdrawnMetric();
        metrics.updatePricingFloorAppliedMetric();
        metrics.updatePricingCeilingAppliedMetric();
        metrics.updateAudienceDimensionMismatchMetric();
        metrics.updateAudienceDegradedMetric();
        metrics.updateReservationFailedMetric();
        metrics.updateReservationReleasedMetric();

        // then
        assertThat(meterRegistry.counter("deal_desk.proposals.submitted").count()).isEqualTo(2.0d);
        assertThat(meterRegistry.counter("deal_desk.proposals.invalid").count()).isEqualTo(1.0d);
        assertThat(meterRegistry.counter("deal_desk.proposals.withdrawn").count()).isEqualTo(1.0d);
        assertThat(meterRegistry.counter("deal_desk.pricing.floor_applied").count()).isEqualTo(1.0d);
        assertThat(meterRegistry.counter("deal_desk.pricing.ceiling_applied").count()).isEqualTo(1.0d);
        assertThat(meterRegistry.counter("deal_desk.audience.dimension_mismatch").count()).isEqualTo(1.0d);
        assertThat(meterRegistry.counter("deal_desk.audience.degraded").count()).isEqualTo(1.0d);
        assertThat(meterRegistry.counter("deal_desk.inventory.reservation_failed").count()).isEqualTo(1.0d);
        assertThat(meterRegistry.counter("deal_desk.inventory.reservation_released").count()).isEqualTo(1.0d);
    }
}
