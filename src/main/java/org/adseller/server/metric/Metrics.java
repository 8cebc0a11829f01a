package org.adseller.server.metric;

import io.micrometer.core.instrument.MeterRegistry;
import org.adseller.server.audience.model.ValidationStatus;
import org.adseller.server.deals.model.DecisionOutcome;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Defines interface for submitting different kinds of metrics produced while negotiating proposals.
 */
public class Metrics {

    private static final String PREFIX = "deal_desk.";
    private static final String DECISIONS = PREFIX + "decisions.";

    private final MeterRegistry meterRegistry;

    public Metrics(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry);
    }

    public void updateProposalSubmittedMetric() {
        incCounter(PREFIX + MetricName.proposals_submitted);
    }

    public void updateProposalInvalidMetric() {
        incCounter(PREFIX + MetricName.proposals_invalid);
    }

    public void updateProposalWithdrawnMetric() {
        incCounter(PREFIX + MetricName.proposals_withdrawn);
    }

    public void updateDecisionMetrics(DecisionOutcome outcome, String inventoryType, long decisionTimeMillis) {
        final MetricName outcomeMetric = switch (outcome) {
            case accepted -> MetricName.accepted;
            case countered -> MetricName.countered;
            case rejected -> MetricName.rejected;
        };
        meterRegistry.counter(DECISIONS + outcomeMetric, "inventory_type", Objects.toString(inventoryType, "unknown"))
                .increment();
        meterRegistry.timer(PREFIX + MetricName.proposals_decision_time)
                .record(decisionTimeMillis, TimeUnit.MILLISECONDS);
    }

    public void updatePricingFloorAppliedMetric() {
        incCounter(PREFIX + MetricName.pricing_floor_applied);
    }

    public void updatePricingCeilingAppliedMetric() {
        incCounter(PREFIX + MetricName.pricing_ceiling_applied);
    }

    public void updateAudienceValidationMetric(ValidationStatus status) {
        meterRegistry.counter(PREFIX + MetricName.audience_validations, "status", status.name()).increment();
    }

    public void updateAudienceDimensionMismatchMetric() {
        incCounter(PREFIX + MetricName.audience_dimension_mismatch);
    }

    public void updateAudienceDegradedMetric() {
        incCounter(PREFIX + MetricName.audience_degraded);
    }

    public void updateReservationFailedMetric() {
        incCounter(PREFIX + MetricName.inventory_reservation_failed);
    }

    public void updateReservationReleasedMetric() {
        incCounter(PREFIX + MetricName.inventory_reservation_released);
    }

    private void incCounter(String name) {
        meterRegistry.counter(name).increment();
    }
}
