package com.loanorigination.service;

import com.loanorigination.config.RedisConfig;
import com.loanorigination.exception.FieldValidationException;
import com.loanorigination.exception.InvalidCalculationInputException;
import com.loanorigination.exception.InvalidTransitionException;
import com.loanorigination.exception.MissingRequiredFieldException;
import com.loanorigination.exception.ProductRuleViolationException;
import com.loanorigination.exception.ResourceNotFoundException;
import com.loanorigination.model.Actor;
import com.loanorigination.model.ApplicationStateMachine;
import com.loanorigination.model.ApplicationStatus;
import com.loanorigination.model.CounterOfferTerms;
import com.loanorigination.model.CreditApplication;
import com.loanorigination.model.LifecycleOutcome;
import com.loanorigination.model.Product;
import com.loanorigination.model.RiskLevel;
import com.loanorigination.repository.ApplicationStatusHistoryRepository;
import com.loanorigination.repository.CreditApplicationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Transactional entry point for every lifecycle change.
 *
 * EACH OPERATION:
 * ===============
 * 1. Loads the application with a row lock, scoped to the tenant
 * 2. Lets {@link ApplicationStateMachine} decide and apply the change
 * 3. Saves the application and its history row
 * 4. Writes the resulting events to the outbox (same transaction)
 * 5. Evicts the cached copy of the application
 *
 * The row lock makes concurrent staff actions on one application run one
 * after the other, so the second one sees the status the first one wrote.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApplicationWorkflowService {

    private final CreditApplicationRepository applicationRepository;
    private final ApplicationStatusHistoryRepository historyRepository;
    private final ProductService productService;
    private final ApplicationStateMachine stateMachine;
    private final OutboxEventWriter outboxEventWriter;

    /**
     * Generic status change that reports refusals as a result instead of an exception.
     * A missing application still throws {@link ResourceNotFoundException}.
     */
    @Transactional
    @CacheEvict(value = RedisConfig.APPLICATIONS_CACHE, key = "#tenantId + ':' + #applicationId")
    public TransitionResult transition(String tenantId,
                                       String applicationId,
                                       ApplicationStatus target,
                                       Actor actor,
                                       String reason,
                                       String notes) {
        CreditApplication application = loadForUpdate(tenantId, applicationId);
        ApplicationStatus current = application.getStatus();

        try {
            LifecycleOutcome outcome = stateMachine.changeStatus(application, target, actor, reason, notes);
            persist(outcome);
            return TransitionResult.success(application.getStatus(), outcome.historyEntry().getId());
        } catch (InvalidTransitionException e) {
            return TransitionResult.failure(e.getCurrentStatus(), e.getAttemptedStatus(),
                    TransitionResult.INVALID_TRANSITION, null, e.getMessage());
        } catch (MissingRequiredFieldException e) {
            log.warn("Transition of {} to {} refused: {}", applicationId, target, e.getMessage());
            return TransitionResult.failure(current, target,
                    TransitionResult.MISSING_REQUIRED_FIELD, e.getField(), e.getMessage());
        } catch (ProductRuleViolationException e) {
            log.warn("Transition of {} to {} refused: {}", applicationId, target, e.getMessage());
            return TransitionResult.failure(current, target, e.getCode(), e.getField(), e.getMessage());
        } catch (FieldValidationException e) {
            log.warn("Transition of {} to {} refused: {}", applicationId, target, e.getMessage());
            return TransitionResult.failure(current, target,
                    TransitionResult.VALIDATION_ERROR, e.getField(), e.getMessage());
        } catch (InvalidCalculationInputException e) {
            log.warn("Transition of {} to {} refused: {}", applicationId, target, e.getMessage());
            return TransitionResult.failure(current, target,
                    TransitionResult.INVALID_CALCULATION_INPUT, null, e.getMessage());
        }
    }

    @Transactional
    @CacheEvict(value = RedisConfig.APPLICATIONS_CACHE, key = "#tenantId + ':' + #applicationId")
    public CreditApplication submit(String tenantId,
                                    String applicationId,
                                    Actor applicant,
                                    Map<String, Object> snapshot) {
        CreditApplication application = loadForUpdate(tenantId, applicationId);
        return persist(stateMachine.submit(application, applicant, snapshot));
    }

    @Transactional
    @CacheEvict(value = RedisConfig.APPLICATIONS_CACHE, key = "#tenantId + ':' + #applicationId")
    public CreditApplication approve(String tenantId,
                                     String applicationId,
                                     Actor staff,
                                     BigDecimal amount,
                                     Integer termMonths,
                                     BigDecimal interestRate,
                                     String notes) {
        CreditApplication application = loadForUpdate(tenantId, applicationId);
        return persist(stateMachine.approve(application, staff, amount, termMonths, interestRate, notes));
    }

    @Transactional
    @CacheEvict(value = RedisConfig.APPLICATIONS_CACHE, key = "#tenantId + ':' + #applicationId")
    public CreditApplication reject(String tenantId,
                                    String applicationId,
                                    Actor staff,
                                    String reason,
                                    String notes) {
        CreditApplication application = loadForUpdate(tenantId, applicationId);
        return persist(stateMachine.reject(application, staff, reason, notes));
    }

    @Transactional
    @CacheEvict(value = RedisConfig.APPLICATIONS_CACHE, key = "#tenantId + ':' + #applicationId")
    public CreditApplication sendCounterOffer(String tenantId,
                                              String applicationId,
                                              Actor staff,
                                              CounterOfferTerms terms) {
        CreditApplication application = loadForUpdate(tenantId, applicationId);
        Product product = productService.getProduct(tenantId, application.getProductId());
        return persist(stateMachine.sendCounterOffer(application, staff, terms, product));
    }

    @Transactional
    @CacheEvict(value = RedisConfig.APPLICATIONS_CACHE, key = "#tenantId + ':' + #applicationId")
    public CreditApplication respondToCounterOffer(String tenantId,
                                                   String applicationId,
                                                   boolean accepted,
                                                   Actor applicant) {
        CreditApplication application = loadForUpdate(tenantId, applicationId);
        return persist(stateMachine.respondToCounterOffer(application, accepted, applicant));
    }

    @Transactional
    @CacheEvict(value = RedisConfig.APPLICATIONS_CACHE, key = "#tenantId + ':' + #applicationId")
    public CreditApplication cancel(String tenantId, String applicationId, Actor actor, String reason) {
        CreditApplication application = loadForUpdate(tenantId, applicationId);
        return persist(stateMachine.cancel(application, actor, reason));
    }

    @Transactional
    @CacheEvict(value = RedisConfig.APPLICATIONS_CACHE, key = "#tenantId + ':' + #applicationId")
    public CreditApplication markSynced(String tenantId,
                                        String applicationId,
                                        String externalId,
                                        String externalSystem,
                                        Map<String, Object> syncData) {
        CreditApplication application = loadForUpdate(tenantId, applicationId);
        return persist(stateMachine.markSynced(application, externalId, externalSystem, syncData));
    }

    @Transactional
    @CacheEvict(value = RedisConfig.APPLICATIONS_CACHE, key = "#tenantId + ':' + #applicationId")
    public CreditApplication setRiskAssessment(String tenantId,
                                               String applicationId,
                                               RiskLevel level,
                                               Map<String, Object> riskData) {
        CreditApplication application = loadForUpdate(tenantId, applicationId);
        return persist(stateMachine.setRiskAssessment(application, level, riskData));
    }

    private CreditApplication loadForUpdate(String tenantId, String applicationId) {
        return applicationRepository.findActiveForUpdate(tenantId, applicationId)
                .orElseThrow(() -> new ResourceNotFoundException("Application", applicationId));
    }

    private CreditApplication persist(LifecycleOutcome outcome) {
        CreditApplication saved = applicationRepository.save(outcome.application());
        if (outcome.historyEntry() != null) {
            historyRepository.save(outcome.historyEntry());
        }
        outcome.events().forEach(outboxEventWriter::write);
        return saved;
    }
}
