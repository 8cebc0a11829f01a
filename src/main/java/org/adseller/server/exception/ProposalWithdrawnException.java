package org.adseller.server.exception;

@SuppressWarnings("serial")
public class ProposalWithdrawnException extends AdSellerException {

    public ProposalWithdrawnException(String proposalId) {
        super("Proposal %s was withdrawn before decision".formatted(proposalId));
    }
}
