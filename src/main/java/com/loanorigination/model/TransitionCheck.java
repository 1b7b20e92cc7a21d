package com.loanorigination.model;

/**
 * Result of asking whether a status change is allowed. Has no side effects.
 */
public record TransitionCheck(
    boolean permitted,
    ApplicationStatus currentStatus,
    ApplicationStatus attemptedStatus
) {
    public static TransitionCheck permitted(ApplicationStatus current, ApplicationStatus attempted) {
        return new TransitionCheck(true, current, attempted);
    }

    public static TransitionCheck denied(ApplicationStatus current, ApplicationStatus attempted) {
        return new TransitionCheck(false, current, attempted);
    }
}
