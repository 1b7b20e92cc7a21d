package com.loanorigination.model;

import com.loanorigination.event.LifecycleEvent;

import java.util.List;

/**
 * What a lifecycle operation produced: the mutated application, the history
 * row to persist (null when the status did not change) and the events to publish.
 */
public record LifecycleOutcome(
    CreditApplication application,
    ApplicationStatusHistory historyEntry,
    List<LifecycleEvent> events
) {
    public LifecycleOutcome {
        if (application == null) {
            throw new IllegalArgumentException("Application cannot be null");
        }
        events = events == null ? List.of() : List.copyOf(events);
    }

    public boolean statusChanged() {
        return historyEntry != null;
    }
}
