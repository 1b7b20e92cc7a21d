package com.loanorigination.calculation;

import java.math.BigDecimal;

/**
 * One row of an amortization schedule. All amounts are rounded to cents.
 */
public record AmortizationEntry(
    int paymentNumber,
    BigDecimal payment,
    BigDecimal principalPortion,
    BigDecimal interestPortion,
    BigDecimal remainingBalance
) {
}
