package com.loanorigination.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Entity representing a credit application.
 *
 * Loan terms and simulation figures are plain mutable fields while the
 * application is a draft. Everything that belongs to the lifecycle (status,
 * decision, approved terms, counter offer, sync data) has no public setter:
 * those fields are written only by {@link ApplicationStateMachine}, which is
 * what keeps the status history complete.
 *
 * Applications are never physically deleted; {@code deletedAt} marks a soft delete.
 */
@Entity
@Table(name = "credit_applications",
       indexes = {
           @Index(name = "idx_app_tenant_status", columnList = "tenantId,status"),
           @Index(name = "idx_app_applicant", columnList = "applicantId")
       })
@Data
@NoArgsConstructor
public class CreditApplication {

    @Id
    private String applicationId;

    @Column(nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String productId;

    @Column(nullable = false)
    private String applicantId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ApplicantType applicantType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Setter(AccessLevel.NONE)
    private ApplicationStatus status = ApplicationStatus.DRAFT;

    // ==================== REQUESTED TERMS ====================

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal requestedAmount;

    @Column(nullable = false)
    private Integer requestedTermMonths;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PaymentFrequency paymentFrequency;

    @Column(nullable = false, precision = 9, scale = 4)
    private BigDecimal interestRate;

    @Column(precision = 9, scale = 4)
    private BigDecimal openingCommissionRate;

    private String purpose;

    @Column(precision = 15, scale = 2)
    private BigDecimal periodicPayment;

    @Column(precision = 15, scale = 2)
    private BigDecimal totalInterest;

    @Column(precision = 15, scale = 2)
    private BigDecimal totalAmount;

    @Column(precision = 9, scale = 4)
    private BigDecimal cat;

    // ==================== DECISION ====================

    @Enumerated(EnumType.STRING)
    @Setter(AccessLevel.NONE)
    private DecisionStatus decision;

    @Setter(AccessLevel.NONE)
    private Instant decisionAt;

    @Setter(AccessLevel.NONE)
    private String decisionBy;

    @Column(length = 2000)
    @Setter(AccessLevel.NONE)
    private String decisionNotes;

    @Column(length = 500)
    @Setter(AccessLevel.NONE)
    private String rejectionReason;

    @Column(precision = 15, scale = 2)
    @Setter(AccessLevel.NONE)
    private BigDecimal approvedAmount;

    @Setter(AccessLevel.NONE)
    private Integer approvedTermMonths;

    @Column(precision = 9, scale = 4)
    @Setter(AccessLevel.NONE)
    private BigDecimal approvedInterestRate;

    @Enumerated(EnumType.STRING)
    @Setter(AccessLevel.NONE)
    private PaymentFrequency approvedPaymentFrequency;

    @Column(precision = 15, scale = 2)
    @Setter(AccessLevel.NONE)
    private BigDecimal approvedPeriodicPayment;

    @Column(precision = 15, scale = 2)
    @Setter(AccessLevel.NONE)
    private BigDecimal approvedTotalAmount;

    @Column(precision = 9, scale = 4)
    @Setter(AccessLevel.NONE)
    private BigDecimal approvedCat;

    @Embedded
    @Setter(AccessLevel.NONE)
    private CounterOffer counterOffer;

    // ==================== RISK & SNAPSHOT ====================

    @Enumerated(EnumType.STRING)
    private RiskLevel riskLevel;

    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> riskData;

    @JdbcTypeCode(SqlTypes.JSON)
    @Setter(AccessLevel.NONE)
    private Map<String, Object> snapshotData;

    // ==================== STATUS TIMESTAMPS ====================

    @Setter(AccessLevel.NONE)
    private Instant statusChangedAt;

    @Setter(AccessLevel.NONE)
    private String statusChangedBy;

    @Enumerated(EnumType.STRING)
    @Setter(AccessLevel.NONE)
    private ActorType statusChangedByType;

    @Setter(AccessLevel.NONE)
    private Instant submittedAt;

    @Setter(AccessLevel.NONE)
    private Instant disbursedAt;

    @Setter(AccessLevel.NONE)
    private Instant cancelledAt;

    // ==================== EXTERNAL SYNC ====================

    @Setter(AccessLevel.NONE)
    private Instant syncedAt;

    @Setter(AccessLevel.NONE)
    private String externalId;

    @Setter(AccessLevel.NONE)
    private String externalSystem;

    @JdbcTypeCode(SqlTypes.JSON)
    @Setter(AccessLevel.NONE)
    private Map<String, Object> syncData;

    // ==================== BOOKKEEPING ====================

    private Instant expiresAt;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    private Instant lastUpdated;

    private Instant deletedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        lastUpdated = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        lastUpdated = Instant.now();
    }

    public boolean isDraft() {
        return status == ApplicationStatus.DRAFT;
    }

    public boolean hasCounterOffer() {
        return counterOffer != null;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }

    // ==================== LIFECYCLE WRITES (state machine only) ====================

    void applyStatus(ApplicationStatus newStatus, Actor actor, Instant at) {
        this.status = newStatus;
        this.statusChangedAt = at;
        this.statusChangedBy = actor.id();
        this.statusChangedByType = actor.type();

        switch (newStatus) {
            case SUBMITTED -> {
                if (submittedAt == null) {
                    submittedAt = at;
                }
            }
            case DISBURSED -> disbursedAt = at;
            case CANCELLED -> cancelledAt = at;
            case SYNCED -> syncedAt = at;
            default -> {
                // no derived timestamp
            }
        }
    }

    void recordSnapshot(Map<String, Object> snapshot) {
        this.snapshotData = snapshot;
    }

    void recordDecision(DecisionStatus decision, String decidedBy, String notes, Instant at) {
        this.decision = decision;
        this.decisionBy = decidedBy;
        this.decisionNotes = notes;
        this.decisionAt = at;
    }

    void recordRejectionReason(String reason) {
        this.rejectionReason = reason;
    }

    void recordApprovedTerms(BigDecimal amount,
                             int termMonths,
                             BigDecimal rate,
                             PaymentFrequency frequency,
                             BigDecimal payment,
                             BigDecimal total,
                             BigDecimal approvedCat) {
        this.approvedAmount = amount;
        this.approvedTermMonths = termMonths;
        this.approvedInterestRate = rate;
        this.approvedPaymentFrequency = frequency;
        this.approvedPeriodicPayment = payment;
        this.approvedTotalAmount = total;
        this.approvedCat = approvedCat;
    }

    void recordCounterOffer(CounterOffer offer) {
        this.counterOffer = offer;
    }

    void recordSync(String externalId, String system, Map<String, Object> syncData) {
        this.externalId = externalId;
        this.externalSystem = system;
        this.syncData = syncData;
    }
}
