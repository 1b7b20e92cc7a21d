package com.loanorigination.service;

import com.loanorigination.calculation.LoanCalculator;
import com.loanorigination.calculation.LoanSimulation;
import com.loanorigination.exception.MissingRequiredFieldException;
import com.loanorigination.exception.ProductRuleViolationException;
import com.loanorigination.exception.ResourceNotFoundException;
import com.loanorigination.model.PaymentFrequency;
import com.loanorigination.model.Product;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SimulationService Unit Tests")
class SimulationServiceTest {

    @Mock
    private ProductService productService;

    @Spy
    private LoanCalculator loanCalculator = new LoanCalculator();

    @InjectMocks
    private SimulationService simulationService;

    private Product product;

    @BeforeEach
    void setUp() {
        product = new Product();
        product.setProductId("product-1");
        product.setTenantId("tenant-1");
        product.setName("Personal loan");
        product.setMinAmount(new BigDecimal("5000"));
        product.setMaxAmount(new BigDecimal("100000"));
        product.setMinTermMonths(6);
        product.setMaxTermMonths(36);
        product.setAnnualRate(new BigDecimal("45"));
        product.setOpeningCommissionRate(new BigDecimal("3"));
    }

    @Test
    @DisplayName("Should price the request with the product rate and commission")
    void shouldSimulateWithProductPricing() {
        // Given
        when(productService.getProduct("tenant-1", "product-1")).thenReturn(product);

        // When
        LoanSimulation simulation = simulationService.simulate(
                "tenant-1", "product-1", new BigDecimal("50000"), 12, PaymentFrequency.MONTHLY);

        // Then
        assertThat(simulation.annualRate()).isEqualByComparingTo("45");
        assertThat(simulation.periodicPayment()).isEqualByComparingTo("5250.62");
        assertThat(simulation.openingCommission()).isEqualByComparingTo("1500.00");
        assertThat(simulation.amortizationSchedule()).hasSize(12);
    }

    @Test
    @DisplayName("Should refuse amounts outside the product range before calculating")
    void shouldRejectAmountOutsideRange() {
        assertThatThrownBy(() -> simulationService.simulate(
                product, new BigDecimal("4999.99"), 12, PaymentFrequency.MONTHLY))
                .isInstanceOf(ProductRuleViolationException.class)
                .hasFieldOrPropertyWithValue("code", ProductRuleViolationException.INVALID_AMOUNT)
                .hasFieldOrPropertyWithValue("field", "amount");

        assertThatThrownBy(() -> simulationService.simulate(
                product, new BigDecimal("100000.01"), 12, PaymentFrequency.MONTHLY))
                .isInstanceOf(ProductRuleViolationException.class);

        verify(loanCalculator, never()).calculateSimulation(any(), anyInt(), any(), any(), any());
    }

    @Test
    @DisplayName("Should accept the range bounds")
    void shouldAcceptBounds() {
        assertThat(simulationService.simulate(product, new BigDecimal("5000"), 6, PaymentFrequency.BIWEEKLY)
                .numberOfPayments()).isEqualTo(12);
        assertThat(simulationService.simulate(product, new BigDecimal("100000"), 36, PaymentFrequency.MONTHLY)
                .numberOfPayments()).isEqualTo(36);
    }

    @Test
    @DisplayName("Should refuse terms outside the product range")
    void shouldRejectTermOutsideRange() {
        assertThatThrownBy(() -> simulationService.simulate(
                product, new BigDecimal("10000"), 48, PaymentFrequency.MONTHLY))
                .isInstanceOf(ProductRuleViolationException.class)
                .hasFieldOrPropertyWithValue("code", ProductRuleViolationException.INVALID_TERM)
                .hasFieldOrPropertyWithValue("field", "term_months");
    }

    @Test
    @DisplayName("Should refuse an inactive product")
    void shouldRejectInactiveProduct() {
        product.setActive(false);

        assertThatThrownBy(() -> simulationService.simulate(
                product, new BigDecimal("10000"), 12, PaymentFrequency.MONTHLY))
                .isInstanceOf(ProductRuleViolationException.class)
                .hasFieldOrPropertyWithValue("code", ProductRuleViolationException.PRODUCT_INACTIVE);
    }

    @Test
    @DisplayName("Should name the missing field")
    void shouldReportMissingFields() {
        assertThatThrownBy(() -> simulationService.simulate(product, null, 12, PaymentFrequency.MONTHLY))
                .isInstanceOf(MissingRequiredFieldException.class)
                .hasFieldOrPropertyWithValue("field", "amount");
        assertThatThrownBy(() -> simulationService.simulate(product, new BigDecimal("10000"), null, PaymentFrequency.MONTHLY))
                .isInstanceOf(MissingRequiredFieldException.class)
                .hasFieldOrPropertyWithValue("field", "term_months");
        assertThatThrownBy(() -> simulationService.simulate(product, new BigDecimal("10000"), 12, null))
                .isInstanceOf(MissingRequiredFieldException.class)
                .hasFieldOrPropertyWithValue("field", "payment_frequency");
    }

    @Test
    @DisplayName("Should propagate an unknown product")
    void shouldPropagateUnknownProduct() {
        // Given
        when(productService.getProduct("tenant-1", "nope"))
                .thenThrow(new ResourceNotFoundException("Product", "nope"));

        // When / Then
        assertThatThrownBy(() -> simulationService.simulate(
                "tenant-1", "nope", new BigDecimal("10000"), 12, PaymentFrequency.MONTHLY))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Product not found: nope");
    }
}
