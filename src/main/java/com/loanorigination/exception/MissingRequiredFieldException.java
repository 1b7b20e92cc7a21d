package com.loanorigination.exception;

/**
 * A field that an operation requires was null or blank, e.g. the reason of a rejection.
 */
public class MissingRequiredFieldException extends FieldValidationException {

    public MissingRequiredFieldException(String field) {
        super(field, "Field '" + field + "' is required");
    }
}
