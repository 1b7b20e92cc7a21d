package com.loanorigination.controller;

import com.loanorigination.exception.FieldValidationException;
import com.loanorigination.exception.MissingRequiredFieldException;
import com.loanorigination.model.Actor;
import com.loanorigination.model.ActorType;
import com.loanorigination.model.ApplicantType;
import com.loanorigination.model.ApplicationStatus;
import com.loanorigination.model.ApplicationStatusHistory;
import com.loanorigination.model.CounterOfferTerms;
import com.loanorigination.model.CreditApplication;
import com.loanorigination.model.PaymentFrequency;
import com.loanorigination.model.RiskLevel;
import com.loanorigination.service.ApplicationService;
import com.loanorigination.service.ApplicationWorkflowService;
import com.loanorigination.service.TransitionResult;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * REST endpoints for credit applications.
 *
 * The tenant comes from the X-Tenant-ID header. The acting user is sent
 * explicitly in each request body; resolving it from a session is the job
 * of the layer in front of this service.
 */
@RestController
@RequestMapping("/api/v2/applications")
@RequiredArgsConstructor
@Slf4j
public class ApplicationController {

    public static final String TENANT_HEADER = "X-Tenant-ID";

    private final ApplicationService applicationService;
    private final ApplicationWorkflowService workflowService;

    // ==================== DRAFTS & READS ====================

    @PostMapping
    public ResponseEntity<CreditApplication> createDraft(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @Valid @RequestBody CreateDraftRequest request) {

        log.info("Received draft request from applicant {} for product {}",
                request.getApplicantId(), request.getProductId());

        CreditApplication application = applicationService.createDraft(
                tenantId,
                request.getApplicantId(),
                request.getProductId(),
                request.getApplicantType() != null ? request.getApplicantType() : ApplicantType.INDIVIDUAL,
                request.getAmount(),
                request.getTermMonths(),
                frequency(request.getPaymentFrequency()),
                request.getPurpose());
        return ResponseEntity.status(HttpStatus.CREATED).body(application);
    }

    @GetMapping
    public ResponseEntity<List<CreditApplication>> getApplicationsForApplicant(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @RequestParam String applicantId) {
        return ResponseEntity.ok(applicationService.getApplicationsForApplicant(tenantId, applicantId));
    }

    @GetMapping("/{applicationId}")
    public ResponseEntity<CreditApplication> getApplication(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String applicationId) {
        return ResponseEntity.ok(applicationService.getApplication(tenantId, applicationId));
    }

    @GetMapping("/{applicationId}/history")
    public ResponseEntity<List<ApplicationStatusHistory>> getHistory(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String applicationId) {
        return ResponseEntity.ok(applicationService.getStatusHistory(tenantId, applicationId));
    }

    @PutMapping("/{applicationId}/terms")
    public ResponseEntity<CreditApplication> updateLoanTerms(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String applicationId,
            @Valid @RequestBody UpdateTermsRequest request) {
        PaymentFrequency frequency = request.getPaymentFrequency() != null
                ? frequency(request.getPaymentFrequency()) : null;
        return ResponseEntity.ok(applicationService.updateLoanTerms(
                tenantId, applicationId, request.getAmount(), request.getTermMonths(), frequency));
    }

    @DeleteMapping("/{applicationId}")
    public ResponseEntity<Void> deleteDraft(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String applicationId) {
        applicationService.deleteDraft(tenantId, applicationId);
        return ResponseEntity.noContent().build();
    }

    // ==================== LIFECYCLE ====================

    /**
     * Generic status change. A refused change answers 409 (transition not
     * allowed) or 422 (missing or invalid field) with the same result body.
     */
    @PostMapping("/{applicationId}/transition")
    public ResponseEntity<TransitionResult> transition(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String applicationId,
            @Valid @RequestBody TransitionRequest request) {

        TransitionResult result = workflowService.transition(
                tenantId,
                applicationId,
                request.getTargetStatus(),
                actor(request.getActorId(), request.getActorType()),
                request.getReason(),
                request.getNotes());

        if (result.success()) {
            return ResponseEntity.ok(result);
        }
        HttpStatus status = TransitionResult.INVALID_TRANSITION.equals(result.errorCode())
                ? HttpStatus.CONFLICT : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(result);
    }

    @PostMapping("/{applicationId}/submit")
    public ResponseEntity<CreditApplication> submit(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String applicationId,
            @Valid @RequestBody SubmitRequest request) {
        return ResponseEntity.ok(workflowService.submit(
                tenantId, applicationId, Actor.applicant(request.getApplicantId()), request.getSnapshot()));
    }

    @PostMapping("/{applicationId}/approve")
    public ResponseEntity<CreditApplication> approve(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String applicationId,
            @Valid @RequestBody ApproveRequest request) {
        return ResponseEntity.ok(workflowService.approve(
                tenantId,
                applicationId,
                Actor.staff(request.getStaffId()),
                request.getAmount(),
                request.getTermMonths(),
                request.getInterestRate(),
                request.getNotes()));
    }

    @PostMapping("/{applicationId}/reject")
    public ResponseEntity<CreditApplication> reject(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String applicationId,
            @Valid @RequestBody RejectRequest request) {
        return ResponseEntity.ok(workflowService.reject(
                tenantId, applicationId, Actor.staff(request.getStaffId()), request.getReason(), request.getNotes()));
    }

    @PostMapping("/{applicationId}/counter-offer")
    public ResponseEntity<CreditApplication> sendCounterOffer(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String applicationId,
            @Valid @RequestBody CounterOfferRequest request) {
        PaymentFrequency frequency = request.getPaymentFrequency() != null
                ? frequency(request.getPaymentFrequency()) : null;
        CounterOfferTerms terms = new CounterOfferTerms(
                request.getAmount(),
                request.getTermMonths(),
                request.getInterestRate(),
                frequency,
                request.getReason());
        return ResponseEntity.ok(workflowService.sendCounterOffer(
                tenantId, applicationId, Actor.staff(request.getStaffId()), terms));
    }

    @PostMapping("/{applicationId}/counter-offer/response")
    public ResponseEntity<CreditApplication> respondToCounterOffer(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String applicationId,
            @Valid @RequestBody CounterOfferResponseRequest request) {
        return ResponseEntity.ok(workflowService.respondToCounterOffer(
                tenantId, applicationId, request.getAccepted(), Actor.applicant(request.getApplicantId())));
    }

    @PostMapping("/{applicationId}/cancel")
    public ResponseEntity<CreditApplication> cancel(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String applicationId,
            @Valid @RequestBody CancelRequest request) {
        return ResponseEntity.ok(workflowService.cancel(
                tenantId, applicationId, actor(request.getActorId(), request.getActorType()), request.getReason()));
    }

    @PostMapping("/{applicationId}/sync")
    public ResponseEntity<CreditApplication> markSynced(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String applicationId,
            @Valid @RequestBody SyncRequest request) {
        return ResponseEntity.ok(workflowService.markSynced(
                tenantId, applicationId, request.getExternalId(), request.getExternalSystem(), request.getSyncData()));
    }

    @PutMapping("/{applicationId}/risk")
    public ResponseEntity<CreditApplication> setRiskAssessment(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable String applicationId,
            @Valid @RequestBody RiskAssessmentRequest request) {
        return ResponseEntity.ok(workflowService.setRiskAssessment(
                tenantId, applicationId, request.getRiskLevel(), request.getRiskData()));
    }

    private static Actor actor(String actorId, ActorType actorType) {
        if (actorType != ActorType.SYSTEM && (actorId == null || actorId.isBlank())) {
            throw new MissingRequiredFieldException("actor_id");
        }
        return new Actor(actorId, actorType);
    }

    private static PaymentFrequency frequency(String value) {
        PaymentFrequency frequency = PaymentFrequency.normalize(value);
        if (frequency == null) {
            throw new FieldValidationException("payment_frequency", "Unknown payment frequency: " + value);
        }
        return frequency;
    }

    // ==================== DTOs ====================

    @Data
    public static class CreateDraftRequest {
        @NotBlank(message = "Applicant is required")
        private String applicantId;

        @NotBlank(message = "Product is required")
        private String productId;

        private ApplicantType applicantType;

        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        private BigDecimal amount;

        @NotNull(message = "Term is required")
        @Positive(message = "Term must be positive")
        private Integer termMonths;

        @NotBlank(message = "Payment frequency is required")
        private String paymentFrequency;

        private String purpose;
    }

    @Data
    public static class UpdateTermsRequest {
        @Positive(message = "Amount must be positive")
        private BigDecimal amount;

        @Positive(message = "Term must be positive")
        private Integer termMonths;

        private String paymentFrequency;
    }

    @Data
    public static class TransitionRequest {
        @NotNull(message = "Target status is required")
        private ApplicationStatus targetStatus;

        private String actorId;

        @NotNull(message = "Actor type is required")
        private ActorType actorType;

        private String reason;

        private String notes;
    }

    @Data
    public static class SubmitRequest {
        @NotBlank(message = "Applicant is required")
        private String applicantId;

        private Map<String, Object> snapshot;
    }

    @Data
    public static class ApproveRequest {
        @NotBlank(message = "Staff member is required")
        private String staffId;

        @Positive(message = "Amount must be positive")
        private BigDecimal amount;

        @Positive(message = "Term must be positive")
        private Integer termMonths;

        @DecimalMin(value = "0", message = "Rate cannot be negative")
        @DecimalMax(value = "100", message = "Rate cannot exceed 100")
        private BigDecimal interestRate;

        private String notes;
    }

    @Data
    public static class RejectRequest {
        @NotBlank(message = "Staff member is required")
        private String staffId;

        @NotBlank(message = "Rejection reason is required")
        private String reason;

        private String notes;
    }

    @Data
    public static class CounterOfferRequest {
        @NotBlank(message = "Staff member is required")
        private String staffId;

        @NotNull(message = "Amount is required")
        @DecimalMin(value = "1000", message = "Amount must be at least 1000")
        private BigDecimal amount;

        @NotNull(message = "Term is required")
        @Min(value = 1, message = "Term must be at least 1 month")
        @Max(value = 120, message = "Term cannot exceed 120 months")
        private Integer termMonths;

        @NotNull(message = "Rate is required")
        @DecimalMin(value = "0", message = "Rate cannot be negative")
        @DecimalMax(value = "100", message = "Rate cannot exceed 100")
        private BigDecimal interestRate;

        private String paymentFrequency;

        private String reason;
    }

    @Data
    public static class CounterOfferResponseRequest {
        @NotBlank(message = "Applicant is required")
        private String applicantId;

        @NotNull(message = "Answer is required")
        private Boolean accepted;
    }

    @Data
    public static class CancelRequest {
        private String actorId;

        @NotNull(message = "Actor type is required")
        private ActorType actorType;

        private String reason;
    }

    @Data
    public static class SyncRequest {
        @NotBlank(message = "External ID is required")
        private String externalId;

        @NotBlank(message = "External system is required")
        private String externalSystem;

        private Map<String, Object> syncData;
    }

    @Data
    public static class RiskAssessmentRequest {
        @NotNull(message = "Risk level is required")
        private RiskLevel riskLevel;

        private Map<String, Object> riskData;
    }
}
