package com.loanorigination.event;

import com.loanorigination.model.PaymentFrequency;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Event published when staff propose alternative terms.
 */
public record CounterOfferSent(
    String eventId,
    String applicationId,
    String tenantId,
    String applicantId,
    BigDecimal requestedAmount,
    BigDecimal amount,
    int termMonths,
    BigDecimal interestRate,
    PaymentFrequency paymentFrequency,
    BigDecimal periodicPayment,
    String reason,
    String offeredBy,
    Instant timestamp
) implements LifecycleEvent {
    public CounterOfferSent {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("Event ID cannot be null or empty");
        }
        if (applicationId == null || applicationId.isBlank()) {
            throw new IllegalArgumentException("Application ID cannot be null or empty");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Offered amount must be positive");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
