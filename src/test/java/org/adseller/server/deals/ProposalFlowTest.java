package org.adseller.server.deals;

import org.adseller.server.deals.model.Decision;
import org.adseller.server.deals.model.DecisionOutcome;
import org.adseller.server.deals.model.Proposal;
import org.adseller.server.deals.model.ProposalState;
import org.adseller.server.exception.ProposalWithdrawnException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

public class ProposalFlowTest {

    private ProposalFlow target;

    @BeforeEach
    public void setUp() {
        target = new ProposalFlow(Proposal.builder().id("proposal-1").productId("product-1").build());
    }

    @Test
    public void advanceToShouldOnlyMoveForward() {
        // when and then
        assertThat(target.state()).isEqualTo(ProposalState.submitted);
        assertThat(target.advanceTo(ProposalState.pricing_evaluating)).isTrue();
        assertThat(target.advanceTo(ProposalState.audience_validating)).isFalse();
        assertThat(target.state()).isEqualTo(ProposalState.pricing_evaluating);
    }

    @Test
    public void advanceToShouldNotEnterTerminalState() {
        assertThatIllegalArgumentException().isThrownBy(() -> target.advanceTo(ProposalState.decided));
    }

    @Test
    public void decideShouldCompleteDecisionOnlyOnce() {
        // given
        final Decision first = givenDecision(DecisionOutcome.accepted);

        // when
        final boolean firstResult = target.decide(first);
        final boolean secondResult = target.decide(givenDecision(DecisionOutcome.rejected));

        // then
        assertThat(firstResult).isTrue();
        assertThat(secondResult).isFalse();
        assertThat(target.state()).isEqualTo(ProposalState.decided);
        assertThat(target.decision().result()).isSameAs(first);
    }

    @Test
    public void withdrawShouldFailDecision() {
        // when
        final boolean result = target.withdraw();

        // then
        assertThat(result).isTrue();
        assertThat(target.state()).isEqualTo(ProposalState.withdrawn);
        assertThat(target.decision().cause()).isInstanceOf(ProposalWithdrawnException.class)
                .hasMessage("Proposal proposal-1 was withdrawn before decision");
    }

    @Test
    public void terminalStatesShouldNotChange() {
        // given
        target.decide(givenDecision(DecisionOutcome.accepted));

        // when and then
        assertThat(target.withdraw()).isFalse();
        assertThat(target.advanceTo(ProposalState.pricing_evaluating)).isFalse();
        assertThat(target.state()).isEqualTo(ProposalState.decided);
    }

    @Test
    public void decideShouldBeIgnoredAfterWithdrawal() {
        // given
        target.withdraw();

        // when and then
        assertThat(target.decide(givenDecision(DecisionOutcome.accepted))).isFalse();
        assertThat(target.decision().failed()).isTrue();
    }

    private static Decision givenDecision(DecisionOutcome outcome) {
        return Decision.builder().proposalId("proposal-1").outcome(outcome).build();
    }
}
