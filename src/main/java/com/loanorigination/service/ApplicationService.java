package com.loanorigination.service;

import com.loanorigination.calculation.LoanSimulation;
import com.loanorigination.config.RedisConfig;
import com.loanorigination.exception.FieldValidationException;
import com.loanorigination.exception.ResourceNotFoundException;
import com.loanorigination.model.ApplicantType;
import com.loanorigination.model.ApplicationStatusHistory;
import com.loanorigination.model.CreditApplication;
import com.loanorigination.model.PaymentFrequency;
import com.loanorigination.model.Product;
import com.loanorigination.repository.ApplicationStatusHistoryRepository;
import com.loanorigination.repository.CreditApplicationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Draft creation and read access for credit applications.
 *
 * Drafts carry the simulation of their requested terms so the applicant sees
 * the same figures before and after creating the application. Everything
 * after the draft stage goes through {@link ApplicationWorkflowService}.
 *
 * CACHING:
 * ========
 * {@link #getApplication} is cached in the "applications" region under
 * "{tenantId}:{applicationId}"; any change evicts that key.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApplicationService {

    private final CreditApplicationRepository applicationRepository;
    private final ApplicationStatusHistoryRepository historyRepository;
    private final ProductService productService;
    private final SimulationService simulationService;
    private final Clock clock;

    @Value("${lending.application.draft-expiry-days:30}")
    private int draftExpiryDays = 30;

    /**
     * Create a DRAFT application for an individual applicant.
     *
     * @throws FieldValidationException for company applicants
     * @throws com.loanorigination.exception.ProductRuleViolationException when the terms do not fit the product
     */
    @Transactional
    public CreditApplication createDraft(String tenantId,
                                         String applicantId,
                                         String productId,
                                         ApplicantType applicantType,
                                         BigDecimal amount,
                                         Integer termMonths,
                                         PaymentFrequency frequency,
                                         String purpose) {
        if (applicantType != ApplicantType.INDIVIDUAL) {
            throw new FieldValidationException("applicant_type",
                    "Only individual applicants are supported");
        }

        Product product = productService.getProduct(tenantId, productId);
        LoanSimulation simulation = simulationService.simulate(product, amount, termMonths, frequency);

        Instant now = clock.instant();
        CreditApplication application = new CreditApplication();
        application.setApplicationId(UUID.randomUUID().toString());
        application.setTenantId(tenantId);
        application.setProductId(productId);
        application.setApplicantId(applicantId);
        application.setApplicantType(applicantType);
        application.setPurpose(purpose);
        application.setInterestRate(product.getAnnualRate());
        application.setOpeningCommissionRate(product.getOpeningCommissionRate());
        applyTerms(application, simulation);
        application.setCreatedAt(now);
        application.setExpiresAt(now.plus(Duration.ofDays(draftExpiryDays)));

        applicationRepository.save(application);

        log.info("Created draft application {} for applicant {} on product {}",
                application.getApplicationId(), applicantId, productId);
        return application;
    }

    /**
     * Change amount, term or frequency of a draft and re-simulate.
     * Null arguments keep the current value.
     */
    @Transactional
    @CacheEvict(value = RedisConfig.APPLICATIONS_CACHE, key = "#tenantId + ':' + #applicationId")
    public CreditApplication updateLoanTerms(String tenantId,
                                             String applicationId,
                                             BigDecimal amount,
                                             Integer termMonths,
                                             PaymentFrequency frequency) {
        CreditApplication application = applicationRepository.findActiveForUpdate(tenantId, applicationId)
                .orElseThrow(() -> new ResourceNotFoundException("Application", applicationId));

        if (!application.isDraft()) {
            throw new FieldValidationException("status",
                    "Loan terms can only be changed while the application is a draft");
        }

        Product product = productService.getProduct(tenantId, application.getProductId());
        LoanSimulation simulation = simulationService.simulate(
                product,
                amount != null ? amount : application.getRequestedAmount(),
                termMonths != null ? termMonths : application.getRequestedTermMonths(),
                frequency != null ? frequency : application.getPaymentFrequency());

        application.setInterestRate(product.getAnnualRate());
        application.setOpeningCommissionRate(product.getOpeningCommissionRate());
        applyTerms(application, simulation);
        applicationRepository.save(application);

        log.info("Updated loan terms of draft {}: amount={}, term={}, frequency={}",
                applicationId, simulation.amount(), simulation.termMonths(), simulation.paymentFrequency());
        return application;
    }

    @Cacheable(value = RedisConfig.APPLICATIONS_CACHE, key = "#tenantId + ':' + #applicationId")
    public CreditApplication getApplication(String tenantId, String applicationId) {
        log.debug("Cache miss - fetching application from database: {}", applicationId);
        return applicationRepository.findActive(tenantId, applicationId)
                .orElseThrow(() -> new ResourceNotFoundException("Application", applicationId));
    }

    /**
     * Status history, newest first.
     */
    public List<ApplicationStatusHistory> getStatusHistory(String tenantId, String applicationId) {
        applicationRepository.findActive(tenantId, applicationId)
                .orElseThrow(() -> new ResourceNotFoundException("Application", applicationId));
        return historyRepository.findByApplicationIdOrderByCreatedAtDesc(applicationId);
    }

    public List<CreditApplication> getApplicationsForApplicant(String tenantId, String applicantId) {
        return applicationRepository.findByTenantIdAndApplicantIdAndDeletedAtIsNullOrderByCreatedAtDesc(
                tenantId, applicantId);
    }

    /**
     * Soft delete. Only drafts may be discarded; submitted applications stay for audit.
     */
    @Transactional
    @CacheEvict(value = RedisConfig.APPLICATIONS_CACHE, key = "#tenantId + ':' + #applicationId")
    public void deleteDraft(String tenantId, String applicationId) {
        CreditApplication application = applicationRepository.findActiveForUpdate(tenantId, applicationId)
                .orElseThrow(() -> new ResourceNotFoundException("Application", applicationId));
        if (!application.isDraft()) {
            throw new FieldValidationException("status", "Only draft applications can be deleted");
        }
        application.setDeletedAt(clock.instant());
        applicationRepository.save(application);
        log.info("Soft-deleted draft application {}", applicationId);
    }

    private void applyTerms(CreditApplication application, LoanSimulation simulation) {
        application.setRequestedAmount(simulation.amount());
        application.setRequestedTermMonths(simulation.termMonths());
        application.setPaymentFrequency(simulation.paymentFrequency());
        application.setPeriodicPayment(simulation.periodicPayment());
        application.setTotalInterest(simulation.totalInterest());
        application.setTotalAmount(simulation.totalAmount());
        application.setCat(simulation.cat());
    }
}
