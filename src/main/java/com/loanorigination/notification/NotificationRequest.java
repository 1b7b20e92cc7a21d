package com.loanorigination.notification;

import java.util.Map;

/**
 * Everything the delivery side needs to render and send one notification.
 */
public record NotificationRequest(
    String tenantId,
    String applicantId,
    String applicationId,
    NotificationEvent event,
    Map<String, Object> variables
) {
    public NotificationRequest {
        if (applicantId == null || applicantId.isBlank()) {
            throw new IllegalArgumentException("Applicant ID cannot be null or empty");
        }
        if (event == null) {
            throw new IllegalArgumentException("Notification event cannot be null");
        }
        variables = variables == null ? Map.of() : Map.copyOf(variables);
    }
}
