package com.loanorigination.exception;

import lombok.Getter;

/**
 * Requested terms fall outside what the product allows.
 */
@Getter
public class ProductRuleViolationException extends FieldValidationException {

    public static final String INVALID_AMOUNT = "INVALID_AMOUNT";
    public static final String INVALID_TERM = "INVALID_TERM";
    public static final String INVALID_RATE = "INVALID_RATE";
    public static final String PRODUCT_INACTIVE = "PRODUCT_INACTIVE";

    private final String code;

    public ProductRuleViolationException(String code, String field, String message) {
        super(field, message);
        this.code = code;
    }
}
