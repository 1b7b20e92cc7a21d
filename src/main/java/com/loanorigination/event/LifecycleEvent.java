package com.loanorigination.event;

import java.time.Instant;

/**
 * Domain event produced by a lifecycle operation and published through the outbox.
 */
public interface LifecycleEvent {

    String eventId();

    String applicationId();

    String tenantId();

    Instant timestamp();

    /**
     * Name stored in the outbox and used to pick the payload type on the way out.
     */
    default String eventType() {
        return getClass().getSimpleName();
    }
}
