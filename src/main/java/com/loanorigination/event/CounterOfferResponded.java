package com.loanorigination.event;

import java.time.Instant;

/**
 * Event published when the applicant accepts or declines a counter offer.
 */
public record CounterOfferResponded(
    String eventId,
    String applicationId,
    String tenantId,
    String applicantId,
    boolean accepted,
    Instant timestamp
) implements LifecycleEvent {
    public CounterOfferResponded {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("Event ID cannot be null or empty");
        }
        if (applicationId == null || applicationId.isBlank()) {
            throw new IllegalArgumentException("Application ID cannot be null or empty");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
