package org.adseller.server.deals.model;

public enum DecisionOutcome {

    accepted, countered, rejected
}
