package com.loanorigination.calculation;

import com.loanorigination.exception.ConvergenceFailureException;
import com.loanorigination.exception.InvalidCalculationInputException;
import com.loanorigination.model.PaymentFrequency;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Loan calculation engine (French / constant-payment amortization).
 *
 * HOW A SIMULATION IS BUILT:
 * ==========================
 * 1. Number of payments = round(termMonths * paymentsPerYear / 12)
 * 2. Periodic rate = annualRate / 100 / paymentsPerYear
 * 3. Payment = P * r / (1 - (1 + r)^-n), or P / n when the rate is zero
 * 4. Total = rounded payment * n, interest = total - principal
 * 5. CAT = effective annual rate of the IRR that equates the net disbursed
 *    amount (principal minus opening commission) to the payment stream
 * 6. Schedule: interest on the outstanding balance each period; the last row
 *    takes whatever balance is left so it closes at exactly 0.00
 *
 * NUMERIC RULES:
 * ==============
 * - BigDecimal with DECIMAL128 for every intermediate value
 * - Money is rounded HALF_UP to cents only when it leaves the engine
 * - Percentages keep 4 decimals
 *
 * Stateless and thread-safe; inputs are expected to be validated against
 * product rules by the caller.
 */
@Slf4j
public class LoanCalculator {

    public static final int DEFAULT_MAX_PAYMENTS = 1000;
    public static final double DEFAULT_CAT_TOLERANCE = 1e-10;
    public static final int DEFAULT_CAT_MAX_ITERATIONS = 100;

    private static final MathContext MC = MathContext.DECIMAL128;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal MONTHS_PER_YEAR = BigDecimal.valueOf(12);
    private static final int MONEY_SCALE = 2;
    private static final int PERCENT_SCALE = 4;

    private final int maxPayments;
    private final double catTolerance;
    private final int catMaxIterations;

    public LoanCalculator() {
        this(DEFAULT_MAX_PAYMENTS, DEFAULT_CAT_TOLERANCE, DEFAULT_CAT_MAX_ITERATIONS);
    }

    public LoanCalculator(int maxPayments, double catTolerance, int catMaxIterations) {
        this.maxPayments = maxPayments;
        this.catTolerance = catTolerance;
        this.catMaxIterations = catMaxIterations;
    }

    /**
     * Compute the full simulation: payment, totals, CAT and amortization schedule.
     *
     * @param amount principal requested
     * @param termMonths loan term in months
     * @param frequency payment frequency
     * @param annualRatePercent nominal annual rate, e.g. 45 for 45%
     * @param openingCommissionRatePercent one-time commission, e.g. 3 for 3% (null means none)
     * @throws InvalidCalculationInputException when the inputs cannot produce a schedule
     * @throws ConvergenceFailureException when the CAT cannot be solved
     */
    public LoanSimulation calculateSimulation(BigDecimal amount,
                                              int termMonths,
                                              PaymentFrequency frequency,
                                              BigDecimal annualRatePercent,
                                              BigDecimal openingCommissionRatePercent) {

        BigDecimal commissionRate = openingCommissionRatePercent == null
                ? BigDecimal.ZERO : openingCommissionRatePercent;
        validate(amount, termMonths, frequency, annualRatePercent, commissionRate);

        BigDecimal principal = money(amount);
        int paymentsPerYear = frequency.getPaymentsPerYear();
        int numberOfPayments = numberOfPayments(termMonths, frequency);
        BigDecimal periodicRate = periodicRate(annualRatePercent, frequency);

        BigDecimal exactPayment = exactPayment(principal, periodicRate, numberOfPayments);
        BigDecimal payment = money(exactPayment);
        if (payment.signum() <= 0) {
            throw new InvalidCalculationInputException(String.format(
                    "Amount %s is too small to spread over %d payments", principal, numberOfPayments));
        }

        BigDecimal totalAmount = payment.multiply(BigDecimal.valueOf(numberOfPayments));
        BigDecimal totalInterest = totalAmount.subtract(principal);

        BigDecimal exactCommission = principal.multiply(commissionRate, MC).divide(HUNDRED, MC);
        BigDecimal exactNetAmount = principal.subtract(exactCommission, MC);

        BigDecimal cat = calculateCat(exactNetAmount, exactPayment, periodicRate, numberOfPayments, paymentsPerYear);
        List<AmortizationEntry> schedule = buildSchedule(principal, periodicRate, exactPayment, numberOfPayments);

        log.debug("Simulated {} over {} {} payments at {}%: payment={}, total={}, cat={}",
                principal, numberOfPayments, frequency, annualRatePercent, payment, totalAmount, cat);

        return new LoanSimulation(
                principal,
                termMonths,
                frequency,
                annualRatePercent,
                periodicRate.multiply(HUNDRED).setScale(PERCENT_SCALE, RoundingMode.HALF_UP),
                numberOfPayments,
                payment,
                commissionRate,
                money(exactCommission),
                money(exactNetAmount),
                totalAmount,
                totalInterest,
                cat,
                schedule
        );
    }

    public int paymentsPerYear(PaymentFrequency frequency) {
        return frequency.getPaymentsPerYear();
    }

    /**
     * Total number of payments for a term, rounded half-up.
     *
     * @throws InvalidCalculationInputException above the configured payment cap
     */
    public int numberOfPayments(int termMonths, PaymentFrequency frequency) {
        long periods = (long) termMonths * frequency.getPaymentsPerYear();
        BigDecimal count = BigDecimal.valueOf(periods).divide(MONTHS_PER_YEAR, 0, RoundingMode.HALF_UP);
        if (count.compareTo(BigDecimal.valueOf(maxPayments)) > 0) {
            throw new InvalidCalculationInputException(String.format(
                    "A %d month term paid %s needs %s payments, more than the limit of %d",
                    termMonths, frequency, count, maxPayments));
        }
        return count.intValue();
    }

    /**
     * Periodic payment rounded to cents.
     */
    public BigDecimal periodicPayment(BigDecimal amount,
                                      int termMonths,
                                      PaymentFrequency frequency,
                                      BigDecimal annualRatePercent) {
        validate(amount, termMonths, frequency, annualRatePercent, BigDecimal.ZERO);
        BigDecimal principal = money(amount);
        return money(exactPayment(principal,
                periodicRate(annualRatePercent, frequency),
                numberOfPayments(termMonths, frequency)));
    }

    private BigDecimal periodicRate(BigDecimal annualRatePercent, PaymentFrequency frequency) {
        return annualRatePercent
                .divide(HUNDRED, MC)
                .divide(BigDecimal.valueOf(frequency.getPaymentsPerYear()), MC);
    }

    private BigDecimal exactPayment(BigDecimal principal, BigDecimal periodicRate, int numberOfPayments) {
        if (periodicRate.signum() == 0) {
            // Straight-line when there is no interest
            return principal.divide(BigDecimal.valueOf(numberOfPayments), MC);
        }
        BigDecimal growth = BigDecimal.ONE.add(periodicRate, MC).pow(numberOfPayments, MC);
        return principal
                .multiply(periodicRate, MC)
                .multiply(growth, MC)
                .divide(growth.subtract(BigDecimal.ONE, MC), MC);
    }

    /**
     * Runs the balance at full precision on the unrounded payment. Each row shows
     * the change in the rounded balance and the rounded interest-to-date, so the
     * principal column adds up to the amount and the last balance is 0.00.
     */
    private List<AmortizationEntry> buildSchedule(BigDecimal principal,
                                                  BigDecimal periodicRate,
                                                  BigDecimal exactPayment,
                                                  int numberOfPayments) {
        List<AmortizationEntry> schedule = new ArrayList<>(numberOfPayments);
        BigDecimal balance = principal;
        BigDecimal interestToDate = BigDecimal.ZERO;
        BigDecimal shownBalance = principal;
        BigDecimal shownInterestToDate = money(BigDecimal.ZERO);

        for (int period = 1; period <= numberOfPayments; period++) {
            BigDecimal interest = balance.multiply(periodicRate, MC);
            interestToDate = interestToDate.add(interest, MC);
            balance = balance.add(interest, MC).subtract(exactPayment, MC);

            BigDecimal nextShownBalance = period == numberOfPayments
                    ? money(BigDecimal.ZERO) : money(balance);
            BigDecimal nextShownInterest = money(interestToDate);
            BigDecimal principalPortion = shownBalance.subtract(nextShownBalance);
            BigDecimal interestPortion = nextShownInterest.subtract(shownInterestToDate);

            schedule.add(new AmortizationEntry(period,
                    principalPortion.add(interestPortion),
                    principalPortion,
                    interestPortion,
                    nextShownBalance));

            shownBalance = nextShownBalance;
            shownInterestToDate = nextShownInterest;
        }

        return schedule;
    }

    /**
     * Solve the periodic IRR with Newton-Raphson and annualise it.
     *
     * PV(i) = payment * sum((1 + i)^-k, k = 1..n) is convex and decreasing.
     * PV at the contractual rate equals the principal, which is never below the
     * net amount, so starting there keeps every iterate left of the root and
     * the sequence moves monotonically towards it.
     */
    private BigDecimal calculateCat(BigDecimal netAmount,
                                    BigDecimal exactPayment,
                                    BigDecimal periodicRate,
                                    int numberOfPayments,
                                    int paymentsPerYear) {
        double net = netAmount.doubleValue();
        double payment = exactPayment.doubleValue();
        double rate = periodicRate.doubleValue();

        for (int iteration = 1; iteration <= catMaxIterations; iteration++) {
            double discount = 1.0 / (1.0 + rate);
            double factor = 1.0;
            double presentValue = 0.0;
            double derivative = 0.0;
            for (int k = 1; k <= numberOfPayments; k++) {
                factor *= discount;
                presentValue += factor;
                derivative -= k * factor * discount;
            }
            double f = payment * presentValue - net;
            double fPrime = payment * derivative;

            if (fPrime == 0.0 || Double.isNaN(f) || Double.isNaN(fPrime)) {
                break;
            }

            double next = rate - f / fPrime;
            if (Double.isNaN(next) || Double.isInfinite(next) || next <= -1.0) {
                break;
            }
            if (Math.abs(next - rate) < catTolerance) {
                double annual = (Math.pow(1.0 + next, paymentsPerYear) - 1.0) * 100.0;
                if (!Double.isFinite(annual)) {
                    throw new InvalidCalculationInputException(String.format(
                            "CAT cannot be represented: a net amount of %s against %d payments of %s "
                          + "gives a periodic rate of %.4g", money(netAmount), numberOfPayments,
                            money(exactPayment), next));
                }
                return BigDecimal.valueOf(annual).setScale(PERCENT_SCALE, RoundingMode.HALF_UP);
            }
            rate = next;
        }

        log.error("CAT did not converge: net={}, payment={}, payments={}, lastRate={}",
                net, payment, numberOfPayments, rate);
        throw new ConvergenceFailureException(String.format(
                "CAT did not converge within %d iterations for %d payments of %s",
                catMaxIterations, numberOfPayments, money(exactPayment)), catMaxIterations);
    }

    private void validate(BigDecimal amount,
                          int termMonths,
                          PaymentFrequency frequency,
                          BigDecimal annualRatePercent,
                          BigDecimal commissionRatePercent) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidCalculationInputException("Amount must be positive");
        }
        if (termMonths <= 0) {
            throw new InvalidCalculationInputException("Term must be at least one month");
        }
        if (frequency == null) {
            throw new InvalidCalculationInputException("Payment frequency is required");
        }
        if (annualRatePercent == null || annualRatePercent.signum() < 0) {
            throw new InvalidCalculationInputException("Annual rate cannot be negative");
        }
        if (commissionRatePercent.signum() < 0 || commissionRatePercent.compareTo(HUNDRED) >= 0) {
            throw new InvalidCalculationInputException("Opening commission rate must be in [0, 100)");
        }
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
