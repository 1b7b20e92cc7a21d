package com.loanorigination.controller;

import com.loanorigination.exception.InvalidTransitionException;
import com.loanorigination.exception.ProductRuleViolationException;
import com.loanorigination.exception.ResourceNotFoundException;
import com.loanorigination.model.Actor;
import com.loanorigination.model.ActorType;
import com.loanorigination.model.ApplicantType;
import com.loanorigination.model.ApplicationStatus;
import com.loanorigination.model.CounterOfferTerms;
import com.loanorigination.model.CreditApplication;
import com.loanorigination.model.PaymentFrequency;
import com.loanorigination.service.ApplicationService;
import com.loanorigination.service.ApplicationWorkflowService;
import com.loanorigination.service.TransitionResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ApplicationController.class)
@DisplayName("ApplicationController Tests")
class ApplicationControllerTest {

    private static final String TENANT = "tenant-1";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ApplicationService applicationService;

    @MockBean
    private ApplicationWorkflowService workflowService;

    private CreditApplication application(ApplicationStatus status) {
        CreditApplication application = new CreditApplication();
        application.setApplicationId("app-1");
        application.setTenantId(TENANT);
        application.setProductId("product-1");
        application.setApplicantId("applicant-1");
        application.setApplicantType(ApplicantType.INDIVIDUAL);
        application.setRequestedAmount(new BigDecimal("50000.00"));
        application.setRequestedTermMonths(12);
        application.setPaymentFrequency(PaymentFrequency.MONTHLY);
        application.setInterestRate(new BigDecimal("45"));
        return application;
    }

    @Test
    @DisplayName("POST /api/v2/applications should create a draft")
    void shouldCreateDraft() throws Exception {
        // Given
        when(applicationService.createDraft(eq(TENANT), eq("applicant-1"), eq("product-1"),
                eq(ApplicantType.INDIVIDUAL), any(BigDecimal.class), eq(12), eq(PaymentFrequency.BIWEEKLY), isNull()))
                .thenReturn(application(ApplicationStatus.DRAFT));

        // When / Then
        mockMvc.perform(post("/api/v2/applications")
                        .header("X-Tenant-ID", TENANT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"applicantId": "applicant-1", "productId": "product-1",
                                 "amount": 50000, "termMonths": 12, "paymentFrequency": "QUINCENAL"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.applicationId").value("app-1"))
                .andExpect(jsonPath("$.status").value("DRAFT"));
    }

    @Test
    @DisplayName("Should reject an unknown payment frequency")
    void shouldRejectUnknownFrequency() throws Exception {
        mockMvc.perform(post("/api/v2/applications")
                        .header("X-Tenant-ID", TENANT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"applicantId": "applicant-1", "productId": "product-1",
                                 "amount": 50000, "termMonths": 12, "paymentFrequency": "DAILY"}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(applicationService);
    }

    @Test
    @DisplayName("Should answer 400 when the tenant header is missing")
    void shouldRequireTenantHeader() throws Exception {
        mockMvc.perform(get("/api/v2/applications/app-1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }

    @Test
    @DisplayName("Should answer 404 for an application of another tenant")
    void shouldAnswerNotFound() throws Exception {
        // Given
        when(applicationService.getApplication("other", "app-1"))
                .thenThrow(new ResourceNotFoundException("Application", "app-1"));

        // When / Then
        mockMvc.perform(get("/api/v2/applications/app-1").header("X-Tenant-ID", "other"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.message").value("Application not found: app-1"));
    }

    @Test
    @DisplayName("GET /api/v2/applications should list the applicant's applications")
    void shouldListApplicationsForApplicant() throws Exception {
        // Given
        when(applicationService.getApplicationsForApplicant(TENANT, "applicant-1"))
                .thenReturn(List.of(application(ApplicationStatus.DRAFT)));

        // When / Then
        mockMvc.perform(get("/api/v2/applications")
                        .header("X-Tenant-ID", TENANT)
                        .param("applicantId", "applicant-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].applicantId").value("applicant-1"));
    }

    @Test
    @DisplayName("Transition refused by the table should answer 409 with both statuses")
    void shouldAnswerConflictForInvalidTransition() throws Exception {
        // Given
        when(workflowService.transition(eq(TENANT), eq("app-1"), eq(ApplicationStatus.APPROVED),
                any(Actor.class), isNull(), isNull()))
                .thenReturn(TransitionResult.failure(ApplicationStatus.DRAFT, ApplicationStatus.APPROVED,
                        TransitionResult.INVALID_TRANSITION, null, "Cannot change status"));

        // When / Then
        mockMvc.perform(post("/api/v2/applications/app-1/transition")
                        .header("X-Tenant-ID", TENANT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"targetStatus": "APPROVED", "actorId": "analyst-7", "actorType": "STAFF"}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.currentStatus").value("DRAFT"))
                .andExpect(jsonPath("$.attemptedStatus").value("APPROVED"));
    }

    @Test
    @DisplayName("Transition with a missing field should answer 422")
    void shouldAnswerUnprocessableForMissingField() throws Exception {
        // Given
        when(workflowService.transition(eq(TENANT), eq("app-1"), eq(ApplicationStatus.REJECTED),
                any(Actor.class), any(), any()))
                .thenReturn(TransitionResult.failure(ApplicationStatus.IN_REVIEW, ApplicationStatus.REJECTED,
                        TransitionResult.MISSING_REQUIRED_FIELD, "reason", "Field 'reason' is required"));

        // When / Then
        mockMvc.perform(post("/api/v2/applications/app-1/transition")
                        .header("X-Tenant-ID", TENANT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"targetStatus": "REJECTED", "actorId": "analyst-7", "actorType": "STAFF"}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorField").value("reason"));
    }

    @Test
    @DisplayName("Successful transition should answer 200 with the new status")
    void shouldAnswerOkForTransition() throws Exception {
        // Given
        when(workflowService.transition(eq(TENANT), eq("app-1"), eq(ApplicationStatus.CANCELLED),
                eq(Actor.SYSTEM), eq("expired"), isNull()))
                .thenReturn(TransitionResult.success(ApplicationStatus.CANCELLED, "hist-1"));

        // When / Then
        mockMvc.perform(post("/api/v2/applications/app-1/transition")
                        .header("X-Tenant-ID", TENANT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"targetStatus": "CANCELLED", "actorType": "SYSTEM", "reason": "expired"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.newStatus").value("CANCELLED"))
                .andExpect(jsonPath("$.historyEntryId").value("hist-1"));
    }

    @Test
    @DisplayName("Staff actor without an id should name actor_id")
    void shouldRequireStaffId() throws Exception {
        mockMvc.perform(post("/api/v2/applications/app-1/transition")
                        .header("X-Tenant-ID", TENANT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"targetStatus": "IN_REVIEW", "actorType": "STAFF"}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.validationErrors.actor_id").value("Field 'actor_id' is required"));

        verifyNoInteractions(workflowService);
    }

    @Test
    @DisplayName("Cancel by an applicant without an id should name actor_id")
    void shouldRequireApplicantIdOnCancel() throws Exception {
        mockMvc.perform(post("/api/v2/applications/app-1/cancel")
                        .header("X-Tenant-ID", TENANT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"actorType": "APPLICANT", "actorId": "  ", "reason": "changed my mind"}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.validationErrors.actor_id").exists());

        verifyNoInteractions(workflowService);
    }

    @Test
    @DisplayName("Reject without reason should fail bean validation")
    void shouldValidateRejectRequest() throws Exception {
        mockMvc.perform(post("/api/v2/applications/app-1/reject")
                        .header("X-Tenant-ID", TENANT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"staffId": "analyst-7"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.validationErrors.reason").value("Rejection reason is required"));
    }

    @Test
    @DisplayName("Approve on a draft should answer 409 with the statuses")
    void shouldMapInvalidTransitionException() throws Exception {
        // Given
        when(workflowService.approve(eq(TENANT), eq("app-1"), any(Actor.class), isNull(), isNull(), isNull(), isNull()))
                .thenThrow(new InvalidTransitionException(ApplicationStatus.DRAFT, ApplicationStatus.APPROVED));

        // When / Then
        mockMvc.perform(post("/api/v2/applications/app-1/approve")
                        .header("X-Tenant-ID", TENANT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"staffId": "analyst-7"}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_TRANSITION"))
                .andExpect(jsonPath("$.currentStatus").value("DRAFT"))
                .andExpect(jsonPath("$.attemptedStatus").value("APPROVED"));
    }

    @Test
    @DisplayName("Counter offer should pass normalized terms to the workflow")
    void shouldSendCounterOffer() throws Exception {
        // Given
        when(workflowService.sendCounterOffer(eq(TENANT), eq("app-1"), any(Actor.class), any(CounterOfferTerms.class)))
                .thenReturn(application(ApplicationStatus.IN_REVIEW));

        // When
        mockMvc.perform(post("/api/v2/applications/app-1/counter-offer")
                        .header("X-Tenant-ID", TENANT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"staffId": "analyst-7", "amount": 25000, "termMonths": 18,
                                 "interestRate": 60, "paymentFrequency": "SEMANAL", "reason": "Lower amount"}
                                """))
                .andExpect(status().isOk());

        // Then
        ArgumentCaptor<CounterOfferTerms> terms = ArgumentCaptor.forClass(CounterOfferTerms.class);
        ArgumentCaptor<Actor> actor = ArgumentCaptor.forClass(Actor.class);
        verify(workflowService).sendCounterOffer(eq(TENANT), eq("app-1"), actor.capture(), terms.capture());
        assertThat(actor.getValue().type()).isEqualTo(ActorType.STAFF);
        assertThat(terms.getValue().paymentFrequency()).isEqualTo(PaymentFrequency.WEEKLY);
        assertThat(terms.getValue().termMonths()).isEqualTo(18);
        assertThat(terms.getValue().amount()).isEqualByComparingTo("25000");
    }

    @Test
    @DisplayName("Counter offer below the minimum amount should fail bean validation")
    void shouldValidateCounterOfferAmount() throws Exception {
        mockMvc.perform(post("/api/v2/applications/app-1/counter-offer")
                        .header("X-Tenant-ID", TENANT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"staffId": "analyst-7", "amount": 500, "termMonths": 18, "interestRate": 60}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.validationErrors.amount").exists());

        verifyNoInteractions(workflowService);
    }

    @Test
    @DisplayName("Product rule violations should answer 422 with their code")
    void shouldMapProductRuleViolation() throws Exception {
        // Given
        when(applicationService.updateLoanTerms(eq(TENANT), eq("app-1"), any(BigDecimal.class), isNull(), isNull()))
                .thenThrow(new ProductRuleViolationException(ProductRuleViolationException.INVALID_AMOUNT,
                        "amount", "Amount must be between 5000 and 100000"));

        // When / Then
        mockMvc.perform(put("/api/v2/applications/app-1/terms")
                        .header("X-Tenant-ID", TENANT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"amount": 200000}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("INVALID_AMOUNT"));
    }

    @Test
    @DisplayName("DELETE should soft delete the draft")
    void shouldDeleteDraft() throws Exception {
        mockMvc.perform(delete("/api/v2/applications/app-1").header("X-Tenant-ID", TENANT))
                .andExpect(status().isNoContent());

        verify(applicationService).deleteDraft(TENANT, "app-1");
    }
}
