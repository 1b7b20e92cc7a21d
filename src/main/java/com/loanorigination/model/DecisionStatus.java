package com.loanorigination.model;

/**
 * Outcome recorded by staff when a credit application is decided.
 */
public enum DecisionStatus {
    APPROVED,        // Credit granted, possibly on adjusted terms
    REJECTED,        // Credit denied, reason recorded
    COUNTER_OFFER    // Alternative terms proposed to the applicant
}
