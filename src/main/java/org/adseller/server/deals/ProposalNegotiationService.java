package org.adseller.server.deals;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.adseller.server.audience.CoverageValidator;
import org.adseller.server.audience.model.AudienceRequest;
import org.adseller.server.audience.model.CoverageResult;
import org.adseller.server.deals.model.CounterTerms;
import org.adseller.server.deals.model.Decision;
import org.adseller.server.deals.model.DecisionOutcome;
import org.adseller.server.deals.model.Proposal;
import org.adseller.server.deals.model.ProposalState;
import org.adseller.server.deals.model.UpsellType;
import org.adseller.server.exception.DimensionMismatchException;
import org.adseller.server.exception.InvalidProposalException;
import org.adseller.server.exception.ProductNotFoundException;
import org.adseller.server.exception.ProposalStateException;
import org.adseller.server.execution.timeout.Timeout;
import org.adseller.server.execution.timeout.TimeoutFactory;
import org.adseller.server.log.ConditionalLogger;
import org.adseller.server.log.Logger;
import org.adseller.server.log.LoggerFactory;
import org.adseller.server.metric.Metrics;
import org.adseller.server.pricing.PricingEngine;
import org.adseller.server.pricing.model.PricingResult;
import org.adseller.server.settings.ProductCatalog;
import org.adseller.server.settings.model.Product;
import org.apache.commons.collections4.ListUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Entry point of proposal negotiation.
 * <p>
 * Every proposal id gets exactly one {@link ProposalFlow}, so a proposal is decided at most once: submitting the
 * same id again returns the decision of the first submission. Every lookup made for a proposal shares a single
 * {@link Timeout}. Audience problems degrade to the not-requested result instead of failing the negotiation,
 * product lookup problems reject the proposal.
 */
public class ProposalNegotiationService {

    private static final Logger logger = LoggerFactory.getLogger(ProposalNegotiationService.class);
    private static final ConditionalLogger conditionalLogger = new ConditionalLogger(logger);

    private static final int DEGRADED_AUDIENCE_LOG_LIMIT = 100;

    private final Vertx vertx;
    private final Clock clock;
    private final TimeoutFactory timeoutFactory;
    private final ProposalValidator proposalValidator;
    private final ProductCatalog productCatalog;
    private final CoverageValidator coverageValidator;
    private final PricingEngine pricingEngine;
    private final DecisionMaker decisionMaker;
    private final DecisionPolicies decisionPolicies;
    private final UpsellAdvisor upsellAdvisor;
    private final InventoryLedger inventoryLedger;
    private final DealIdGenerator dealIdGenerator;
    private final Metrics metrics;
    private final String sellerOrgId;
    private final long timeoutMillis;

    private final Map<String, ProposalFlow> flows = new ConcurrentHashMap<>();

    public ProposalNegotiationService(Vertx vertx,
                                      Clock clock,
                                      TimeoutFactory timeoutFactory,
                                      ProposalValidator proposalValidator,
                                      ProductCatalog productCatalog,
                                      CoverageValidator coverageValidator,
                                      PricingEngine pricingEngine,
                                      DecisionMaker decisionMaker,
                                      DecisionPolicies decisionPolicies,
                                      UpsellAdvisor upsellAdvisor,
                                      InventoryLedger inventoryLedger,
                                      DealIdGenerator dealIdGenerator,
                                      Metrics metrics,
                                      String sellerOrgId,
                                      long timeoutMillis) {

        if (timeoutMillis < 1) {
            throw new IllegalArgumentException("Negotiation timeout must be positive, but was " + timeoutMillis);
        }

        this.vertx = Objects.requireNonNull(vertx);
        this.clock = Objects.requireNonNull(clock);
        this.timeoutFactory = Objects.requireNonNull(timeoutFactory);
        this.proposalValidator = Objects.requireNonNull(proposalValidator);
        this.productCatalog = Objects.requireNonNull(productCatalog);
        this.coverageValidator = Objects.requireNonNull(coverageValidator);
        this.pricingEngine = Objects.requireNonNull(pricingEngine);
        this.decisionMaker = Objects.requireNonNull(decisionMaker);
        this.decisionPolicies = Objects.requireNonNull(decisionPolicies);
        this.upsellAdvisor = Objects.requireNonNull(upsellAdvisor);
        this.inventoryLedger = Objects.requireNonNull(inventoryLedger);
        this.dealIdGenerator = Objects.requireNonNull(dealIdGenerator);
        this.metrics = Objects.requireNonNull(metrics);
        this.sellerOrgId = sellerOrgId;
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * Starts negotiation of the proposal and returns its eventual decision. The future fails with
     * {@link org.adseller.server.exception.ProposalWithdrawnException} if the proposal is withdrawn first.
     */
    public Future<Decision> submit(Proposal proposal) {
        metrics.updateProposalSubmittedMetric();

        try {
            proposalValidator.validate(proposal);
        } catch (InvalidProposalException e) {
            metrics.updateProposalInvalidMetric();
            logger.debug("Proposal rejected at intake: {}", e.getMessage());
            return Future.succeededFuture(invalidProposal(proposal, e));
        }

        final ProposalFlow flow = new ProposalFlow(proposal);
        final ProposalFlow existing = flows.putIfAbsent(proposal.getId(), flow);
        if (existing != null) {
            logger.debug("Proposal {} is already negotiated, returning its decision", proposal.getId());
            return existing.decision();
        }

        negotiate(flow);
        return flow.decision();
    }

    /**
     * Withdraws a proposal which is not decided yet.
     */
    public Future<Void> withdraw(String proposalId) {
        final ProposalFlow flow = proposalId != null ? flows.get(proposalId) : null;
        if (flow == null) {
            return Future.failedFuture(new ProposalStateException("Unknown proposal: " + proposalId));
        }
        if (!flow.withdraw()) {
            return Future.failedFuture(new ProposalStateException(
                    "Proposal %s cannot be withdrawn, it is already %s".formatted(proposalId, flow.state())));
        }

        metrics.updateProposalWithdrawnMetric();
        logger.info("Proposal {} withdrawn", proposalId);
        return Future.succeededFuture();
    }

    public Optional<ProposalState> getState(String proposalId) {
        return Optional.ofNullable(proposalId)
                .map(flows::get)
                .map(ProposalFlow::state);
    }

    private void negotiate(ProposalFlow flow) {
        final Proposal proposal = flow.getProposal();
        final Timeout timeout = timeoutFactory.create(timeoutMillis);
        final long startTime = clock.millis();

        withTimeout(() -> productCatalog.getProduct(proposal.getProductId(), timeout), timeout)
                .onComplete(productResult -> {
                    if (productResult.failed()) {
                        complete(flow, null, productUnavailable(proposal, productResult.cause()), startTime);
                        return;
                    }
                    if (flow.state().isTerminal()) {
                        return;
                    }

                    final Product product = productResult.result();
                    // a synchronous failure of evaluation still decides the proposal
                    Future.succeededFuture(product)
                            .compose(value -> evaluate(flow, value, timeout))
                            .recover(error -> Future.succeededFuture(evaluationFailed(proposal, error)))
                            .onSuccess(decision -> complete(flow, product, decision, startTime));
                });
    }

    private Future<Decision> evaluate(ProposalFlow flow, Product product, Timeout timeout) {
        final Proposal proposal = flow.getProposal();
        if (proposal.getAudienceRequest() != null) {
            flow.advanceTo(ProposalState.audience_validating);
        }

        final Future<List<Product>> catalogFuture = listCatalog(proposal, timeout);
        final Future<CoverageResult> coverageFuture = validateAudience(proposal, product, timeout)
                .onSuccess(ignored -> flow.advanceTo(ProposalState.pricing_evaluating));
        final Future<PricingResult> pricingFuture = Future.future(promise -> promise.complete(
                pricingEngine.calculatePrice(product, proposal.getBuyerContext(), proposal.getVolume())));

        return Future.all(coverageFuture, pricingFuture, catalogFuture)
                .map(ignored -> decisionMaker.decide(
                        proposal,
                        decisionPolicies.forInventoryType(product.getInventoryType()),
                        pricingFuture.result(),
                        coverageFuture.result()))
                .map(draft -> draft.toBuilder()
                        .upsellSuggestions(upsellAdvisor.suggest(proposal, product, draft, catalogFuture.result()))
                        .build())
                .compose(draft -> draft.getOutcome() == DecisionOutcome.accepted
                        ? reserve(flow, product, draft, timeout)
                        : Future.succeededFuture(draft));
    }

    /**
     * Lists the catalog for upsell suggestions. A failed listing only costs the suggestions.
     */
    private Future<List<Product>> listCatalog(Proposal proposal, Timeout timeout) {
        return withTimeout(() -> productCatalog.getProducts(timeout), timeout)
                .recover(error -> {
                    logger.debug("Upsell catalog unavailable for proposal {}: {}", proposal.getId(), error.getMessage());
                    return Future.succeededFuture(Collections.emptyList());
                });
    }

    private Future<CoverageResult> validateAudience(Proposal proposal, Product product, Timeout timeout) {
        final AudienceRequest audienceRequest = proposal.getAudienceRequest();
        if (audienceRequest == null) {
            return Future.succeededFuture(CoverageResult.notRequested("Audience validation not requested"));
        }

        return withTimeout(() -> productCatalog.getCapabilityEmbeddings(product.getId(), timeout), timeout)
                .map(capabilities -> coverageValidator.validate(audienceRequest, capabilities))
                .onSuccess(result -> metrics.updateAudienceValidationMetric(result.getValidationStatus()))
                .recover(error -> Future.succeededFuture(degradedAudience(proposal, error)));
    }

    private CoverageResult degradedAudience(Proposal proposal, Throwable error) {
        metrics.updateAudienceDegradedMetric();

        final String reason;
        if (error instanceof DimensionMismatchException) {
            metrics.updateAudienceDimensionMismatchMetric();
            reason = error.getMessage();
        } else if (error instanceof TimeoutException) {
            reason = "Capability lookup timed out";
        } else {
            reason = "Capability lookup failed: " + error.getMessage();
        }

        conditionalLogger.warn("Audience validation skipped for proposal %s: %s".formatted(proposal.getId(), reason),
                DEGRADED_AUDIENCE_LOG_LIMIT);
        return CoverageResult.notRequested("Audience validation skipped: " + reason);
    }

    private Future<Decision> reserve(ProposalFlow flow, Product product, Decision draft, Timeout timeout) {
        final Proposal proposal = flow.getProposal();
        if (flow.state().isTerminal()) {
            return Future.succeededFuture(draft);
        }

        final Future<Boolean> reservation = inventoryLedger.reserve(product.getId(), proposal.getVolume());
        return withTimeout(() -> reservation, timeout).compose(
                reserved -> Future.succeededFuture(reserved
                        ? accepted(proposal, product, draft)
                        : inventoryUnavailable(proposal, draft, "Requested volume is not available")),
                error -> {
                    // a late reservation is returned to the avails
                    reservation.onSuccess(reserved -> {
                        if (Boolean.TRUE.equals(reserved)) {
                            release(product.getId(), proposal.getVolume());
                        }
                    });
                    metrics.updateReservationFailedMetric();
                    logger.warn("Inventory reservation for proposal {} failed: {}",
                            proposal.getId(), error.getMessage());
                    return Future.succeededFuture(
                            inventoryUnavailable(proposal, draft, "Inventory reservation could not be confirmed"));
                });
    }

    private Decision accepted(Proposal proposal, Product product, Decision draft) {
        final Instant proposalTimestamp = proposal.getSubmittedAt() != null
                ? proposal.getSubmittedAt()
                : clock.instant();

        return draft.toBuilder()
                .dealId(dealIdGenerator.generate(sellerOrgId, product.getId(), proposalTimestamp))
                .build();
    }

    private Decision inventoryUnavailable(Proposal proposal, Decision draft, String reason) {
        return draft.toBuilder()
                .outcome(DecisionOutcome.countered)
                .reasons(List.copyOf(ListUtils.union(draft.getReasons(), List.of(reason))))
                .upsellSuggestions(draft.getUpsellSuggestions().stream()
                        .filter(suggestion -> suggestion.getType() != UpsellType.volume_upgrade)
                        .toList())
                .counterTerms(CounterTerms.of(
                        draft.getPricingResult().getFinalPrice(),
                        proposal.getVolume(),
                        "Requested volume of %d impressions cannot be reserved".formatted(proposal.getVolume())))
                .build();
    }

    private void complete(ProposalFlow flow, Product product, Decision decision, long startTime) {
        final Decision finalDecision = decision.toBuilder().decidedAt(clock.instant()).build();

        if (flow.decide(finalDecision)) {
            final String inventoryType = product != null ? product.getInventoryType() : null;
            metrics.updateDecisionMetrics(finalDecision.getOutcome(), inventoryType, clock.millis() - startTime);
            updatePricingMetrics(finalDecision.getPricingResult());
            logger.debug("Proposal {} {}: {}",
                    finalDecision.getProposalId(), finalDecision.getOutcome(), finalDecision.getReasons());
            return;
        }

        if (product != null && decision.getOutcome() == DecisionOutcome.accepted && decision.getDealId() != null) {
            release(product.getId(), flow.getProposal().getVolume());
            logger.info("Proposal {} was withdrawn during reservation, released its inventory",
                    flow.getProposal().getId());
        }
    }

    private void release(String productId, long volume) {
        inventoryLedger.release(productId, volume)
                .onSuccess(ignored -> metrics.updateReservationReleasedMetric())
                .onFailure(error -> logger.error("Failed to release {} impressions of product {}: {}",
                        volume, productId, error.getMessage()));
    }

    private void updatePricingMetrics(PricingResult pricingResult) {
        if (pricingResult == null) {
            return;
        }
        if (pricingResult.isFlooredApplied()) {
            metrics.updatePricingFloorAppliedMetric();
        }
        if (pricingResult.isCeilingApplied()) {
            metrics.updatePricingCeilingAppliedMetric();
        }
    }

    private Decision invalidProposal(Proposal proposal, InvalidProposalException exception) {
        return Decision.builder()
                .proposalId(proposal != null ? proposal.getId() : null)
                .outcome(DecisionOutcome.rejected)
                .reasons(exception.getMessages())
                .decidedAt(clock.instant())
                .build();
    }

    private static Decision productUnavailable(Proposal proposal, Throwable error) {
        final String reason;
        if (error instanceof ProductNotFoundException) {
            reason = "Product not found: " + proposal.getProductId();
        } else {
            logger.warn("Product catalog unavailable for proposal {}: {}", proposal.getId(), error.getMessage());
            reason = "Product catalog unavailable";
        }

        return Decision.builder()
                .proposalId(proposal.getId())
                .outcome(DecisionOutcome.rejected)
                .reasons(List.of(reason))
                .build();
    }

    private static Decision evaluationFailed(Proposal proposal, Throwable error) {
        logger.error("Proposal %s could not be evaluated".formatted(proposal.getId()), error);
        return Decision.builder()
                .proposalId(proposal.getId())
                .outcome(DecisionOutcome.rejected)
                .reasons(List.of("Proposal could not be evaluated: " + error.getMessage()))
                .build();
    }

    private <T> Future<T> withTimeout(Supplier<Future<T>> futureFactory, Timeout timeout) {
        final long remainingTime = timeout.remaining();
        if (remainingTime <= 0L) {
            return Future.failedFuture(new TimeoutException("Timeout has been exceeded"));
        }

        final Future<T> future;
        try {
            future = Objects.requireNonNull(futureFactory.get());
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }

        final Promise<T> promise = Promise.promise();

        final long timerId = vertx.setTimer(remainingTime, id ->
                promise.tryFail(new TimeoutException("Timeout has been exceeded")));

        future.onComplete(result -> {
            vertx.cancelTimer(timerId);
            if (result.succeeded()) {
                promise.tryComplete(result.result());
            } else {
                promise.tryFail(result.cause());
            }
        });

        return promise.future();
    }
}
