package com.loanorigination.consumer;

import com.loanorigination.config.KafkaTopics;
import com.loanorigination.event.ApplicationStatusChanged;
import com.loanorigination.event.CounterOfferSent;
import com.loanorigination.notification.NotificationEvent;
import com.loanorigination.notification.NotificationGateway;
import com.loanorigination.notification.NotificationRequest;
import com.loanorigination.service.IdempotencyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

/**
 * Turns status changes and counter offers into applicant notifications.
 *
 * Flow:
 * 1. The workflow service writes the lifecycle event to the outbox
 * 2. The outbox publisher sends it to Kafka
 * 3. This consumer skips duplicates and staff-only statuses
 * 4. The matching notification request goes to the {@link NotificationGateway}
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApplicationNotificationConsumer {

    private static final String CONSUMER_NAME = "ApplicationNotificationConsumer";

    private final IdempotencyService idempotencyService;
    private final NotificationGateway notificationGateway;

    @KafkaListener(
            topics = KafkaTopics.APPLICATION_STATUS_CHANGED,
            groupId = "application-notification-group",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void onStatusChanged(ApplicationStatusChanged event) {
        log.info("Received ApplicationStatusChanged {} for application {}: {} -> {}",
                event.eventId(), event.applicationId(), event.fromStatus(), event.toStatus());

        if (!event.toStatus().isVisibleToApplicant()) {
            log.debug("Status {} is staff-only, no applicant notification for {}",
                    event.toStatus(), event.applicationId());
            return;
        }
        if (event.applicantId() == null) {
            log.warn("Application {} has no applicant, skipping notification", event.applicationId());
            return;
        }

        NotificationEvent notification = NotificationEvent.forStatus(event.toStatus());
        deliver(event.eventType(), event.eventId(), new NotificationRequest(
                event.tenantId(),
                event.applicantId(),
                event.applicationId(),
                notification,
                variables(event)));
    }

    /**
     * Counter offers reach the applicant whatever review stage the application is in.
     */
    @KafkaListener(
            topics = KafkaTopics.COUNTER_OFFER_SENT,
            groupId = "application-notification-group",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void onCounterOfferSent(CounterOfferSent event) {
        log.info("Received CounterOfferSent {} for application {}: amount={}, term={}, rate={}",
                event.eventId(), event.applicationId(), event.amount(), event.termMonths(), event.interestRate());

        if (event.applicantId() == null) {
            log.warn("Application {} has no applicant, skipping counter offer notification", event.applicationId());
            return;
        }

        deliver(event.eventType(), event.eventId(), new NotificationRequest(
                event.tenantId(),
                event.applicantId(),
                event.applicationId(),
                NotificationEvent.APPLICATION_COUNTER_OFFER,
                variables(event)));
    }

    private void deliver(String eventType, String eventId, NotificationRequest request) {
        if (!idempotencyService.claim(CONSUMER_NAME, eventType, eventId)) {
            return;
        }

        try {
            notificationGateway.send(request);
        } catch (RuntimeException e) {
            idempotencyService.release(CONSUMER_NAME, eventId);
            throw e;
        }

        log.info("Requested {} notification for application {}", request.event().getKey(), request.applicationId());
    }

    private Map<String, Object> variables(ApplicationStatusChanged event) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("application.id", event.applicationId());
        variables.put("application.status", event.toStatus().getLabel());
        if (event.fromStatus() != null) {
            variables.put("application.previous_status", event.fromStatus().getLabel());
        }
        if (event.reason() != null) {
            variables.put("application.reason", event.reason());
        }
        return variables;
    }

    private Map<String, Object> variables(CounterOfferSent event) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("application.id", event.applicationId());
        if (event.requestedAmount() != null) {
            variables.put("counter_offer.original_amount", event.requestedAmount());
        }
        variables.put("counter_offer.amount", event.amount());
        variables.put("counter_offer.term_months", event.termMonths());
        variables.put("counter_offer.interest_rate", event.interestRate());
        if (event.periodicPayment() != null) {
            variables.put("counter_offer.payment", event.periodicPayment());
        }
        if (event.paymentFrequency() != null) {
            variables.put("counter_offer.payment_frequency", event.paymentFrequency().getLabel());
        }
        if (event.reason() != null) {
            variables.put("counter_offer.reason", event.reason());
        }
        return variables;
    }
}
