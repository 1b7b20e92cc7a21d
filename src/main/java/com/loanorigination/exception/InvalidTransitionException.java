package com.loanorigination.exception;

import com.loanorigination.model.ApplicationStatus;
import lombok.Getter;

/**
 * Thrown when a status change is not present in the transition table.
 * Carries both statuses so the API layer can build a precise message.
 */
@Getter
public class InvalidTransitionException extends LendingException {

    private final ApplicationStatus currentStatus;
    private final ApplicationStatus attemptedStatus;

    public InvalidTransitionException(ApplicationStatus currentStatus, ApplicationStatus attemptedStatus) {
        super(String.format("Cannot change status from '%s' to '%s'",
                label(currentStatus), label(attemptedStatus)));
        this.currentStatus = currentStatus;
        this.attemptedStatus = attemptedStatus;
    }

    private static String label(ApplicationStatus status) {
        return status != null ? status.getLabel() : "none";
    }
}
