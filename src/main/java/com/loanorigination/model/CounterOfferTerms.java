package com.loanorigination.model;

import java.math.BigDecimal;

/**
 * Terms staff propose in a counter offer. A null frequency keeps the one
 * the applicant requested.
 */
public record CounterOfferTerms(
    BigDecimal amount,
    Integer termMonths,
    BigDecimal interestRate,
    PaymentFrequency paymentFrequency,
    String reason
) {
}
