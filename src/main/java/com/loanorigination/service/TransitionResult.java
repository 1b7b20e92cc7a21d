package com.loanorigination.service;

import com.loanorigination.model.ApplicationStatus;

/**
 * Outcome of {@link ApplicationWorkflowService#transition}. Either the new
 * status with its history entry, or why the change was refused.
 */
public record TransitionResult(
    boolean success,
    ApplicationStatus newStatus,
    String historyEntryId,
    ApplicationStatus currentStatus,
    ApplicationStatus attemptedStatus,
    String errorCode,
    String errorField,
    String errorReason
) {
    public static final String INVALID_TRANSITION = "INVALID_TRANSITION";
    public static final String MISSING_REQUIRED_FIELD = "MISSING_REQUIRED_FIELD";
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String INVALID_CALCULATION_INPUT = "INVALID_CALCULATION_INPUT";

    public static TransitionResult success(ApplicationStatus newStatus, String historyEntryId) {
        return new TransitionResult(true, newStatus, historyEntryId, null, null, null, null, null);
    }

    public static TransitionResult failure(ApplicationStatus currentStatus,
                                           ApplicationStatus attemptedStatus,
                                           String errorCode,
                                           String errorField,
                                           String errorReason) {
        return new TransitionResult(false, null, null, currentStatus, attemptedStatus,
                errorCode, errorField, errorReason);
    }
}
