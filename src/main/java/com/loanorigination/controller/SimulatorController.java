package com.loanorigination.controller;

import com.loanorigination.calculation.LoanSimulation;
import com.loanorigination.exception.FieldValidationException;
import com.loanorigination.model.PaymentFrequency;
import com.loanorigination.service.SimulationService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;

/**
 * Loan simulation shown to applicants before they create an application.
 */
@RestController
@RequestMapping("/api/v2/simulator")
@RequiredArgsConstructor
@Slf4j
public class SimulatorController {

    private final SimulationService simulationService;

    /**
     * POST /api/v2/simulator/calculate
     *
     * Example request:
     * {
     *   "productId": "prod-personal",
     *   "amount": 50000,
     *   "termMonths": 12,
     *   "paymentFrequency": "MONTHLY"
     * }
     *
     * The frequency also accepts SEMANAL, QUINCENAL and MENSUAL.
     */
    @PostMapping("/calculate")
    public ResponseEntity<LoanSimulation> calculate(
            @RequestHeader(ApplicationController.TENANT_HEADER) String tenantId,
            @Valid @RequestBody SimulationRequest request) {

        PaymentFrequency frequency = PaymentFrequency.normalize(request.getPaymentFrequency());
        if (frequency == null) {
            throw new FieldValidationException("payment_frequency",
                    "Unknown payment frequency: " + request.getPaymentFrequency());
        }

        LoanSimulation simulation = simulationService.simulate(
                tenantId,
                request.getProductId(),
                request.getAmount(),
                request.getTermMonths(),
                frequency);
        return ResponseEntity.ok(simulation);
    }

    @Data
    public static class SimulationRequest {
        @NotBlank(message = "Product is required")
        private String productId;

        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        private BigDecimal amount;

        @NotNull(message = "Term is required")
        @Positive(message = "Term must be positive")
        private Integer termMonths;

        @NotBlank(message = "Payment frequency is required")
        private String paymentFrequency;
    }
}
