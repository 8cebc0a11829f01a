package org.adseller.server.metric;

public enum MetricName {

    // proposals
    proposals_submitted("proposals.submitted"),
    proposals_invalid("proposals.invalid"),
    proposals_withdrawn("proposals.withdrawn"),
    proposals_decision_time("proposals.decision_time"),

    // decision outcomes
    accepted,
    countered,
    rejected,

    // pricing
    pricing_floor_applied("pricing.floor_applied"),
    pricing_ceiling_applied("pricing.ceiling_applied"),

    // audience
    audience_validations("audience.validations"),
    audience_dimension_mismatch("audience.dimension_mismatch"),
    audience_degraded("audience.degraded"),

    // inventory
    inventory_reservation_failed("inventory.reservation_failed"),
    inventory_reservation_released("inventory.reservation_released");

    private final String name;

    MetricName() {
        this.name = name();
    }

    MetricName(String name) {
        this.name = name;
    }

    @Override
    public String toString() {
        return name;
    }
}
