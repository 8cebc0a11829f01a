package org.adseller.server.deals.model;

public enum ProposalState {

    submitted,
    audience_validating,
    pricing_evaluating,
    decided,
    withdrawn;

    public boolean isTerminal() {
        return this == decided || this == withdrawn;
    }
}
