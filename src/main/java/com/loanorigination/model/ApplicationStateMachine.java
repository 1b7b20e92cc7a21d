package com.loanorigination.model;

import com.loanorigination.calculation.LoanCalculator;
import com.loanorigination.calculation.LoanSimulation;
import com.loanorigination.event.ApplicationStatusChanged;
import com.loanorigination.event.CounterOfferResponded;
import com.loanorigination.event.CounterOfferSent;
import com.loanorigination.event.LifecycleEvent;
import com.loanorigination.exception.FieldValidationException;
import com.loanorigination.exception.InvalidTransitionException;
import com.loanorigination.exception.MissingRequiredFieldException;
import com.loanorigination.exception.NoPendingCounterOfferException;
import com.loanorigination.exception.ProductRuleViolationException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Decides and applies every lifecycle change of a {@link CreditApplication}.
 *
 * RULES:
 * ======
 * - A status change is applied only when {@link ApplicationStatus#canTransitionTo}
 *   allows it; otherwise {@link InvalidTransitionException} is thrown and the
 *   application is left untouched.
 * - Every applied change produces exactly one {@link ApplicationStatusHistory}
 *   row and one {@link ApplicationStatusChanged} event.
 * - Nothing here touches the database or a broker. Callers persist the
 *   returned {@link LifecycleOutcome} and publish its events.
 *
 * The actor is always passed in; there is no notion of a current user.
 */
@Slf4j
public class ApplicationStateMachine {

    private static final BigDecimal MAX_RATE = BigDecimal.valueOf(100);

    private final LoanCalculator calculator;
    private final Clock clock;

    public ApplicationStateMachine(LoanCalculator calculator, Clock clock) {
        this.calculator = calculator;
        this.clock = clock;
    }

    public TransitionCheck validateTransition(ApplicationStatus current, ApplicationStatus target) {
        if (current != null && current.canTransitionTo(target)) {
            return TransitionCheck.permitted(current, target);
        }
        return TransitionCheck.denied(current, target);
    }

    /**
     * Generic status change. Rejections need a reason; approvals go through
     * {@link #approve} with the requested terms so the approved figures are
     * always filled in.
     */
    public LifecycleOutcome changeStatus(CreditApplication application,
                                         ApplicationStatus target,
                                         Actor actor,
                                         String reason,
                                         String notes) {
        if (target == null) {
            throw new MissingRequiredFieldException("status");
        }
        if (target == ApplicationStatus.APPROVED) {
            return approve(application, actor, null, null, null, notes);
        }
        if (target == ApplicationStatus.REJECTED) {
            return reject(application, actor, reason, notes);
        }
        requireTransition(application, target);
        return applyTransition(application, target, actor, reason, notes, new ArrayList<>());
    }

    /**
     * Applicant sends the application for review. The snapshot is a
     * point-in-time copy of the applicant data and is kept as given.
     */
    public LifecycleOutcome submit(CreditApplication application,
                                   Actor applicant,
                                   Map<String, Object> snapshot) {
        requireTransition(application, ApplicationStatus.SUBMITTED);
        Instant now = clock.instant();
        if (application.isDraft() && application.isExpired(now)) {
            throw new FieldValidationException("expires_at",
                    "Draft expired at " + application.getExpiresAt());
        }
        if (snapshot != null) {
            application.recordSnapshot(snapshot);
        }
        return applyTransition(application, ApplicationStatus.SUBMITTED, applicant, null, null, new ArrayList<>());
    }

    /**
     * Approve on the requested terms, or on adjusted ones when any of
     * amount, term or rate is given. Adjusted terms are re-simulated so the
     * approved payment, total and CAT always match the approved terms.
     */
    public LifecycleOutcome approve(CreditApplication application,
                                    Actor staff,
                                    BigDecimal amount,
                                    Integer termMonths,
                                    BigDecimal interestRate,
                                    String notes) {
        requireTransition(application, ApplicationStatus.APPROVED);

        BigDecimal effectiveAmount = amount != null ? amount : application.getRequestedAmount();
        int effectiveTerm = termMonths != null ? termMonths : application.getRequestedTermMonths();
        BigDecimal effectiveRate = interestRate != null ? interestRate : application.getInterestRate();
        requireRate(effectiveRate);

        boolean termsChanged = effectiveAmount.compareTo(application.getRequestedAmount()) != 0
                || effectiveTerm != application.getRequestedTermMonths()
                || effectiveRate.compareTo(application.getInterestRate()) != 0;

        BigDecimal payment;
        BigDecimal total;
        BigDecimal cat;
        if (termsChanged || application.getPeriodicPayment() == null) {
            LoanSimulation simulation = calculator.calculateSimulation(
                    effectiveAmount,
                    effectiveTerm,
                    application.getPaymentFrequency(),
                    effectiveRate,
                    application.getOpeningCommissionRate());
            payment = simulation.periodicPayment();
            total = simulation.totalAmount();
            cat = simulation.cat();
            log.debug("Re-simulated approval terms for application {}: payment={}", application.getApplicationId(), payment);
        } else {
            payment = application.getPeriodicPayment();
            total = application.getTotalAmount();
            cat = application.getCat();
        }

        Instant now = clock.instant();
        application.recordDecision(DecisionStatus.APPROVED, staff.id(), notes, now);
        application.recordApprovedTerms(effectiveAmount, effectiveTerm, effectiveRate,
                application.getPaymentFrequency(), payment, total, cat);
        return applyTransition(application, ApplicationStatus.APPROVED, staff, null, notes, new ArrayList<>());
    }

    public LifecycleOutcome reject(CreditApplication application, Actor staff, String reason, String notes) {
        requireTransition(application, ApplicationStatus.REJECTED);
        if (reason == null || reason.isBlank()) {
            throw new MissingRequiredFieldException("reason");
        }

        application.recordDecision(DecisionStatus.REJECTED, staff.id(), notes, clock.instant());
        application.recordRejectionReason(reason);
        return applyTransition(application, ApplicationStatus.REJECTED, staff, reason, notes, new ArrayList<>());
    }

    /**
     * Propose alternative terms while the application is under review.
     * The status does not change; the offer waits for the applicant.
     */
    public LifecycleOutcome sendCounterOffer(CreditApplication application,
                                             Actor staff,
                                             CounterOfferTerms terms,
                                             Product product) {
        ApplicationStatus current = application.getStatus();
        if (!current.isReview()) {
            throw new InvalidTransitionException(current, ApplicationStatus.COUNTER_OFFERED);
        }
        validateCounterOffer(terms, product);

        PaymentFrequency frequency = terms.paymentFrequency() != null
                ? terms.paymentFrequency() : application.getPaymentFrequency();
        LoanSimulation simulation = calculator.calculateSimulation(
                terms.amount(),
                terms.termMonths(),
                frequency,
                terms.interestRate(),
                application.getOpeningCommissionRate());

        Instant now = clock.instant();
        CounterOffer offer = new CounterOffer(
                terms.amount(),
                terms.termMonths(),
                terms.interestRate(),
                frequency,
                simulation.periodicPayment(),
                simulation.totalAmount(),
                simulation.cat(),
                terms.reason(),
                staff.id(),
                now);
        application.recordDecision(DecisionStatus.COUNTER_OFFER, staff.id(), terms.reason(), now);
        application.recordCounterOffer(offer);

        log.info("Counter offer sent for application {}: amount={}, term={}, rate={}",
                application.getApplicationId(), terms.amount(), terms.termMonths(), terms.interestRate());

        LifecycleEvent event = new CounterOfferSent(
                UUID.randomUUID().toString(),
                application.getApplicationId(),
                application.getTenantId(),
                application.getApplicantId(),
                application.getRequestedAmount(),
                offer.getAmount(),
                offer.getTermMonths(),
                offer.getInterestRate(),
                offer.getPaymentFrequency(),
                offer.getPeriodicPayment(),
                offer.getReason(),
                staff.id(),
                now);
        return new LifecycleOutcome(application, null, List.of(event));
    }

    /**
     * Record the applicant's answer. Accepting approves the application on
     * the offered terms; declining leaves it in review for staff.
     */
    public LifecycleOutcome respondToCounterOffer(CreditApplication application,
                                                  boolean accepted,
                                                  Actor applicant) {
        CounterOffer offer = application.getCounterOffer();
        if (offer == null || !offer.isPending()) {
            throw new NoPendingCounterOfferException(application.getApplicationId());
        }
        if (accepted) {
            requireTransition(application, ApplicationStatus.APPROVED);
        }

        Instant now = clock.instant();
        offer.respond(accepted, now);

        List<LifecycleEvent> events = new ArrayList<>();
        events.add(new CounterOfferResponded(
                UUID.randomUUID().toString(),
                application.getApplicationId(),
                application.getTenantId(),
                application.getApplicantId(),
                accepted,
                now));

        if (!accepted) {
            log.info("Counter offer declined for application {}", application.getApplicationId());
            return new LifecycleOutcome(application, null, events);
        }

        application.recordDecision(DecisionStatus.APPROVED, offer.getOfferedBy(), "Counter offer accepted", now);
        application.recordApprovedTerms(
                offer.getAmount(),
                offer.getTermMonths(),
                offer.getInterestRate(),
                offer.getPaymentFrequency(),
                offer.getPeriodicPayment(),
                offer.getTotalAmount(),
                offer.getCat());
        return applyTransition(application, ApplicationStatus.APPROVED, applicant, null,
                "Counter offer accepted", events);
    }

    public LifecycleOutcome cancel(CreditApplication application, Actor actor, String reason) {
        requireTransition(application, ApplicationStatus.CANCELLED);
        return applyTransition(application, ApplicationStatus.CANCELLED, actor, reason, null, new ArrayList<>());
    }

    /**
     * Record that the approved application now lives in an external core
     * banking system. Always performed by the system actor.
     */
    public LifecycleOutcome markSynced(CreditApplication application,
                                       String externalId,
                                       String externalSystem,
                                       Map<String, Object> syncData) {
        if (externalId == null || externalId.isBlank()) {
            throw new MissingRequiredFieldException("external_id");
        }
        if (externalSystem == null || externalSystem.isBlank()) {
            throw new MissingRequiredFieldException("external_system");
        }
        requireTransition(application, ApplicationStatus.SYNCED);

        application.recordSync(externalId, externalSystem, syncData);
        return applyTransition(application, ApplicationStatus.SYNCED, Actor.SYSTEM, null, null, new ArrayList<>());
    }

    public LifecycleOutcome setRiskAssessment(CreditApplication application,
                                              RiskLevel level,
                                              Map<String, Object> riskData) {
        if (level == null) {
            throw new MissingRequiredFieldException("risk_level");
        }
        application.setRiskLevel(level);
        application.setRiskData(riskData);
        return new LifecycleOutcome(application, null, List.of());
    }

    // ==================== INTERNALS ====================

    private void requireTransition(CreditApplication application, ApplicationStatus target) {
        TransitionCheck check = validateTransition(application.getStatus(), target);
        if (!check.permitted()) {
            log.warn("Rejected transition for application {}: {} -> {}",
                    application.getApplicationId(), check.currentStatus(), check.attemptedStatus());
            throw new InvalidTransitionException(check.currentStatus(), check.attemptedStatus());
        }
    }

    private void requireRate(BigDecimal rate) {
        if (rate == null || rate.signum() < 0 || rate.compareTo(MAX_RATE) > 0) {
            throw new ProductRuleViolationException(ProductRuleViolationException.INVALID_RATE,
                    "interest_rate", "Interest rate must be between 0 and 100");
        }
    }

    private void validateCounterOffer(CounterOfferTerms terms, Product product) {
        if (terms == null || terms.amount() == null) {
            throw new MissingRequiredFieldException("amount");
        }
        if (terms.termMonths() == null) {
            throw new MissingRequiredFieldException("term_months");
        }
        if (terms.amount().compareTo(product.getMinAmount()) < 0) {
            throw new ProductRuleViolationException(ProductRuleViolationException.INVALID_AMOUNT, "amount",
                    "Offered amount must be at least " + product.getMinAmount());
        }
        if (!product.isTermValid(terms.termMonths())) {
            throw new ProductRuleViolationException(ProductRuleViolationException.INVALID_TERM, "term_months",
                    String.format("Offered term must be between %d and %d months",
                            product.getMinTermMonths(), product.getMaxTermMonths()));
        }
        if (terms.interestRate() == null) {
            throw new MissingRequiredFieldException("interest_rate");
        }
        requireRate(terms.interestRate());
    }

    private LifecycleOutcome applyTransition(CreditApplication application,
                                             ApplicationStatus target,
                                             Actor actor,
                                             String reason,
                                             String notes,
                                             List<LifecycleEvent> events) {
        ApplicationStatus from = application.getStatus();
        Instant now = clock.instant();

        application.applyStatus(target, actor, now);
        ApplicationStatusHistory entry = ApplicationStatusHistory.of(
                application.getApplicationId(),
                from,
                target,
                actor,
                historyNotes(reason, notes),
                now);

        events.add(new ApplicationStatusChanged(
                UUID.randomUUID().toString(),
                application.getApplicationId(),
                application.getTenantId(),
                application.getApplicantId(),
                from,
                target,
                actor.id(),
                actor.type(),
                reason,
                now));

        log.info("Application {} moved {} -> {} by {} {}",
                application.getApplicationId(), from, target, actor.type(), actor.id());
        return new LifecycleOutcome(application, entry, events);
    }

    private static String historyNotes(String reason, String notes) {
        boolean hasReason = reason != null && !reason.isBlank();
        boolean hasNotes = notes != null && !notes.isBlank();
        if (hasReason && hasNotes) {
            return reason + "\n" + notes;
        }
        return hasReason ? reason : notes;
    }
}
