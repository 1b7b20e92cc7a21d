package com.loanorigination.event;

import com.loanorigination.model.ActorType;
import com.loanorigination.model.ApplicationStatus;

import java.time.Instant;

/**
 * Event published after every applied status change.
 *
 * Downstream consumers use it to notify the applicant; staff-only statuses
 * are published too and filtered on the consuming side.
 */
public record ApplicationStatusChanged(
    String eventId,
    String applicationId,
    String tenantId,
    String applicantId,
    ApplicationStatus fromStatus,   // Null for the very first status
    ApplicationStatus toStatus,
    String changedBy,               // Null when the system changed it
    ActorType changedByType,
    String reason,
    Instant timestamp
) implements LifecycleEvent {
    public ApplicationStatusChanged {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("Event ID cannot be null or empty");
        }
        if (applicationId == null || applicationId.isBlank()) {
            throw new IllegalArgumentException("Application ID cannot be null or empty");
        }
        if (toStatus == null) {
            throw new IllegalArgumentException("Target status cannot be null");
        }
        if (changedByType == null) {
            throw new IllegalArgumentException("Actor type cannot be null");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
