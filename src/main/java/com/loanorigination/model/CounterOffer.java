package com.loanorigination.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Alternative terms proposed by staff. {@code accepted} stays null until the
 * applicant answers.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CounterOffer {

    @Column(name = "counter_offer_amount", precision = 15, scale = 2)
    private BigDecimal amount;

    @Column(name = "counter_offer_term_months")
    private Integer termMonths;

    @Column(name = "counter_offer_rate", precision = 9, scale = 4)
    private BigDecimal interestRate;

    @Enumerated(EnumType.STRING)
    @Column(name = "counter_offer_frequency")
    private PaymentFrequency paymentFrequency;

    @Column(name = "counter_offer_payment", precision = 15, scale = 2)
    private BigDecimal periodicPayment;

    @Column(name = "counter_offer_total", precision = 15, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "counter_offer_cat", precision = 9, scale = 4)
    private BigDecimal cat;

    @Column(name = "counter_offer_reason", length = 1000)
    private String reason;

    @Column(name = "counter_offer_by")
    private String offeredBy;

    @Column(name = "counter_offer_at")
    private Instant offeredAt;

    @Column(name = "counter_offer_responded_at")
    private Instant respondedAt;

    @Column(name = "counter_offer_accepted")
    private Boolean accepted;

    CounterOffer(BigDecimal amount,
                 int termMonths,
                 BigDecimal interestRate,
                 PaymentFrequency paymentFrequency,
                 BigDecimal periodicPayment,
                 BigDecimal totalAmount,
                 BigDecimal cat,
                 String reason,
                 String offeredBy,
                 Instant offeredAt) {
        this.amount = amount;
        this.termMonths = termMonths;
        this.interestRate = interestRate;
        this.paymentFrequency = paymentFrequency;
        this.periodicPayment = periodicPayment;
        this.totalAmount = totalAmount;
        this.cat = cat;
        this.reason = reason;
        this.offeredBy = offeredBy;
        this.offeredAt = offeredAt;
    }

    public boolean isPending() {
        return offeredAt != null && accepted == null;
    }

    void respond(boolean accepted, Instant at) {
        this.accepted = accepted;
        this.respondedAt = at;
    }
}
