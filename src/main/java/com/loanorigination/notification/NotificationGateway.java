package com.loanorigination.notification;

/**
 * Hand-off point to the notification delivery service (SMS, WhatsApp, email).
 * Channels, templates and retries live on the other side.
 */
public interface NotificationGateway {

    void send(NotificationRequest request);
}
