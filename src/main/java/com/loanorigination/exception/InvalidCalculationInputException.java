package com.loanorigination.exception;

/**
 * Inputs to the loan calculator that cannot produce a schedule
 * (non-positive amount or term, negative rate, too many payments).
 */
public class InvalidCalculationInputException extends LendingException {

    public InvalidCalculationInputException(String message) {
        super(message);
    }
}
