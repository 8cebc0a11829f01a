package org.adseller.server.deals;

import org.adseller.server.deals.model.Proposal;
import org.adseller.server.exception.InvalidProposalException;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Intake checks of an incoming {@link Proposal}. A proposal that fails them never enters negotiation.
 */
public class ProposalValidator {

    public void validate(Proposal proposal) throws InvalidProposalException {
        if (proposal == null) {
            throw new InvalidProposalException("Proposal must be present");
        }

        final List<String> errors = new ArrayList<>();
        if (StringUtils.isBlank(proposal.getId())) {
            errors.add("Proposal id is missing");
        }
        if (StringUtils.isBlank(proposal.getProductId())) {
            errors.add("Proposal product id is missing");
        }
        if (proposal.getVolume() < 0) {
            errors.add("Proposal volume must be non-negative, but was " + proposal.getVolume());
        }
        if (proposal.getBuyerContext() == null) {
            errors.add("Proposal buyer context is missing");
        }
        if (proposal.getProposedPrice() != null && proposal.getProposedPrice().signum() < 0) {
            errors.add("Proposed price must be non-negative, but was " + proposal.getProposedPrice());
        }
        if (proposal.getAudienceRequest() != null && proposal.getAudienceRequest().getEmbedding() == null) {
            errors.add("Audience targeting requires a buyer embedding");
        }

        if (!errors.isEmpty()) {
            throw new InvalidProposalException(errors);
        }
    }
}
