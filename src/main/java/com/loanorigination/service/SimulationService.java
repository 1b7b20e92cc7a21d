package com.loanorigination.service;

import com.loanorigination.calculation.LoanCalculator;
import com.loanorigination.calculation.LoanSimulation;
import com.loanorigination.exception.MissingRequiredFieldException;
import com.loanorigination.exception.ProductRuleViolationException;
import com.loanorigination.model.PaymentFrequency;
import com.loanorigination.model.Product;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Loan simulation against a product: checks the request fits the product,
 * then prices it with the product's rate and opening commission.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SimulationService {

    private final ProductService productService;
    private final LoanCalculator loanCalculator;

    public LoanSimulation simulate(String tenantId,
                                   String productId,
                                   BigDecimal amount,
                                   Integer termMonths,
                                   PaymentFrequency frequency) {
        Product product = productService.getProduct(tenantId, productId);
        return simulate(product, amount, termMonths, frequency);
    }

    public LoanSimulation simulate(Product product,
                                   BigDecimal amount,
                                   Integer termMonths,
                                   PaymentFrequency frequency) {
        validateAgainstProduct(product, amount, termMonths, frequency);

        LoanSimulation simulation = loanCalculator.calculateSimulation(
                amount,
                termMonths,
                frequency,
                product.getAnnualRate(),
                product.getOpeningCommissionRate());

        log.info("Simulated product {}: amount={}, term={}, frequency={}, payment={}, cat={}",
                product.getProductId(), amount, termMonths, frequency,
                simulation.periodicPayment(), simulation.cat());
        return simulation;
    }

    /**
     * Product-level rules checked before the engine runs.
     *
     * @throws ProductRuleViolationException with PRODUCT_INACTIVE, INVALID_AMOUNT or INVALID_TERM
     */
    public void validateAgainstProduct(Product product,
                                       BigDecimal amount,
                                       Integer termMonths,
                                       PaymentFrequency frequency) {
        if (!product.isActive()) {
            throw new ProductRuleViolationException(ProductRuleViolationException.PRODUCT_INACTIVE,
                    "product_id", "Product is not available: " + product.getProductId());
        }
        if (amount == null) {
            throw new MissingRequiredFieldException("amount");
        }
        if (termMonths == null) {
            throw new MissingRequiredFieldException("term_months");
        }
        if (frequency == null) {
            throw new MissingRequiredFieldException("payment_frequency");
        }
        if (!product.isAmountValid(amount)) {
            throw new ProductRuleViolationException(ProductRuleViolationException.INVALID_AMOUNT, "amount",
                    String.format("Amount must be between %s and %s",
                            product.getMinAmount(), product.getMaxAmount()));
        }
        if (!product.isTermValid(termMonths)) {
            throw new ProductRuleViolationException(ProductRuleViolationException.INVALID_TERM, "term_months",
                    String.format("Term must be between %d and %d months",
                            product.getMinTermMonths(), product.getMaxTermMonths()));
        }
    }
}
