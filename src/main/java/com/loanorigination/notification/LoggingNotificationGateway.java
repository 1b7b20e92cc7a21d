package com.loanorigination.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Gateway used until a delivery service is wired in: records the request in the log.
 */
@Component
@Slf4j
public class LoggingNotificationGateway implements NotificationGateway {

    @Override
    public void send(NotificationRequest request) {
        log.info("Notification {} for applicant {} (tenant {}, application {}): {}",
                request.event().getKey(),
                request.applicantId(),
                request.tenantId(),
                request.applicationId(),
                request.variables());
    }
}
