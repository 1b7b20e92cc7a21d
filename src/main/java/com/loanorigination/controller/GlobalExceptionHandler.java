package com.loanorigination.controller;

import com.loanorigination.exception.ConvergenceFailureException;
import com.loanorigination.exception.FieldValidationException;
import com.loanorigination.exception.InvalidCalculationInputException;
import com.loanorigination.exception.InvalidTransitionException;
import com.loanorigination.exception.NoPendingCounterOfferException;
import com.loanorigination.exception.ProductRuleViolationException;
import com.loanorigination.exception.ResourceNotFoundException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps domain exceptions to HTTP responses.
 *
 * 404 missing resource, 409 refused status change, 422 business-rule
 * violation, 400 malformed request, 500 computation fault.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFound(ResourceNotFoundException ex) {
        log.warn("Resource not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ErrorResponse.builder()
                .error("Resource Not Found")
                .code("NOT_FOUND")
                .message(ex.getMessage()));
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTransition(InvalidTransitionException ex) {
        log.warn("Invalid transition: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ErrorResponse.builder()
                .error("Invalid Status Transition")
                .code("INVALID_TRANSITION")
                .message(ex.getMessage())
                .currentStatus(ex.getCurrentStatus().name())
                .attemptedStatus(ex.getAttemptedStatus().name()));
    }

    @ExceptionHandler(NoPendingCounterOfferException.class)
    public ResponseEntity<ErrorResponse> handleNoPendingCounterOffer(NoPendingCounterOfferException ex) {
        log.warn("Counter offer response refused: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ErrorResponse.builder()
                .error("No Pending Counter Offer")
                .code("NO_PENDING_COUNTER_OFFER")
                .message(ex.getMessage()));
    }

    @ExceptionHandler(ProductRuleViolationException.class)
    public ResponseEntity<ErrorResponse> handleProductRuleViolation(ProductRuleViolationException ex) {
        log.warn("Product rule violated ({}): {}", ex.getCode(), ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ErrorResponse.builder()
                .error("Product Rule Violation")
                .code(ex.getCode())
                .message(ex.getMessage())
                .validationErrors(Map.of(ex.getField(), ex.getMessage())));
    }

    @ExceptionHandler(FieldValidationException.class)
    public ResponseEntity<ErrorResponse> handleFieldValidation(FieldValidationException ex) {
        log.warn("Validation failed on {}: {}", ex.getField(), ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ErrorResponse.builder()
                .error("Validation Failed")
                .code("VALIDATION_ERROR")
                .message(ex.getMessage())
                .validationErrors(Map.of(ex.getField(), ex.getMessage())));
    }

    @ExceptionHandler(InvalidCalculationInputException.class)
    public ResponseEntity<ErrorResponse> handleInvalidCalculationInput(InvalidCalculationInputException ex) {
        log.warn("Invalid calculation input: {}", ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ErrorResponse.builder()
                .error("Invalid Calculation Input")
                .code("INVALID_CALCULATION_INPUT")
                .message(ex.getMessage()));
    }

    @ExceptionHandler(ConvergenceFailureException.class)
    public ResponseEntity<ErrorResponse> handleConvergenceFailure(ConvergenceFailureException ex) {
        log.error("CAT calculation anomaly after {} iterations: {}", ex.getIterations(), ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorResponse.builder()
                .error("Calculation Error")
                .code("CONVERGENCE_FAILURE")
                .message("The total annual cost could not be calculated for these terms"));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        return respond(HttpStatus.BAD_REQUEST, ErrorResponse.builder()
                .error("Validation Failed")
                .code("INVALID_REQUEST")
                .message("Invalid input parameters")
                .validationErrors(errors));
    }

    @ExceptionHandler({MissingRequestHeaderException.class,
                       MissingServletRequestParameterException.class,
                       HttpMessageNotReadableException.class,
                       IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ErrorResponse.builder()
                .error("Invalid Request")
                .code("INVALID_REQUEST")
                .message(ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error: ", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorResponse.builder()
                .error("Internal Server Error")
                .code("INTERNAL_ERROR")
                .message("An unexpected error occurred"));
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, ErrorResponse.ErrorResponseBuilder builder) {
        ErrorResponse body = builder
                .timestamp(Instant.now())
                .status(status.value())
                .build();
        return ResponseEntity.status(status).body(body);
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorResponse {
        private Instant timestamp;
        private int status;
        private String error;
        private String code;
        private String message;
        private String currentStatus;
        private String attemptedStatus;
        private Map<String, String> validationErrors;
    }
}
