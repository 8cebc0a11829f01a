package org.adseller.server.deals;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import lombok.Getter;
import org.adseller.server.deals.model.Decision;
import org.adseller.server.deals.model.Proposal;
import org.adseller.server.deals.model.ProposalState;
import org.adseller.server.exception.ProposalWithdrawnException;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Negotiation state of a single proposal.
 * <p>
 * Moves forward only: submitted, audience_validating, pricing_evaluating, then decided. A flow may be withdrawn
 * from any non-terminal state. Once terminal it never changes again, so the decision is completed at most once.
 */
public class ProposalFlow {

    @Getter
    private final Proposal proposal;

    private final AtomicReference<ProposalState> state = new AtomicReference<>(ProposalState.submitted);
    private final Promise<Decision> decisionPromise = Promise.promise();

    public ProposalFlow(Proposal proposal) {
        this.proposal = Objects.requireNonNull(proposal);
    }

    public ProposalState state() {
        return state.get();
    }

    public Future<Decision> decision() {
        return decisionPromise.future();
    }

    /**
     * Advances to the given intermediate state. Returns false when the flow is already past it or terminal.
     */
    public boolean advanceTo(ProposalState next) {
        if (next.isTerminal()) {
            throw new IllegalArgumentException("Terminal state cannot be entered by advancing: " + next);
        }

        while (true) {
            final ProposalState current = state.get();
            if (current.isTerminal() || current.ordinal() >= next.ordinal()) {
                return false;
            }
            if (state.compareAndSet(current, next)) {
                return true;
            }
        }
    }

    /**
     * Completes the flow with the decision. Returns false when the flow was withdrawn or decided before.
     */
    public boolean decide(Decision decision) {
        if (!enterTerminal(ProposalState.decided)) {
            return false;
        }
        decisionPromise.complete(decision);
        return true;
    }

    /**
     * Withdraws the flow. Returns false when it is already terminal.
     */
    public boolean withdraw() {
        if (!enterTerminal(ProposalState.withdrawn)) {
            return false;
        }
        decisionPromise.fail(new ProposalWithdrawnException(proposal.getId()));
        return true;
    }

    private boolean enterTerminal(ProposalState terminal) {
        while (true) {
            final ProposalState current = state.get();
            if (current.isTerminal()) {
                return false;
            }
            if (state.compareAndSet(current, terminal)) {
                return true;
            }
        }
    }
}
