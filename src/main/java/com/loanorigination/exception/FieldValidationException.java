package com.loanorigination.exception;

import lombok.Getter;

/**
 * Field-level validation failure.
 */
@Getter
public class FieldValidationException extends LendingException {

    private final String field;

    public FieldValidationException(String field, String message) {
        super(message);
        this.field = field;
    }
}
