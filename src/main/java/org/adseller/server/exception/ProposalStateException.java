package org.adseller.server.exception;

/**
 * Thrown when an operation is not allowed for the current state of a proposal, for example a withdrawal of an
 * already decided proposal.
 */
@SuppressWarnings("serial")
public class ProposalStateException extends AdSellerException {

    public ProposalStateException(String message) {
        super(message);
    }
}
