package com.loanorigination.exception;

import lombok.Getter;

/**
 * The CAT root-find did not settle within the iteration cap.
 * This is a computation fault, not a user input error.
 */
@Getter
public class ConvergenceFailureException extends LendingException {

    private final int iterations;

    public ConvergenceFailureException(String message, int iterations) {
        super(message);
        this.iterations = iterations;
    }
}
