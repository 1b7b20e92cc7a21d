package com.loanorigination.calculation;

import com.loanorigination.model.PaymentFrequency;

import java.math.BigDecimal;
import java.util.List;

/**
 * Result of a loan simulation. Transient: never persisted as such.
 *
 * Money fields have scale 2, percentage fields scale 4.
 */
public record LoanSimulation(
    BigDecimal amount,
    int termMonths,
    PaymentFrequency paymentFrequency,
    BigDecimal annualRate,
    BigDecimal periodicRatePercent,
    int numberOfPayments,
    BigDecimal periodicPayment,
    BigDecimal openingCommissionRate,
    BigDecimal openingCommission,
    BigDecimal netAmount,
    BigDecimal totalAmount,
    BigDecimal totalInterest,
    BigDecimal cat,
    List<AmortizationEntry> amortizationSchedule
) {
    public LoanSimulation {
        amortizationSchedule = List.copyOf(amortizationSchedule);
    }
}
