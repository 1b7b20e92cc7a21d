package com.loanorigination.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.loanorigination.config.KafkaTopics;
import com.loanorigination.event.ApplicationStatusChanged;
import com.loanorigination.event.CounterOfferResponded;
import com.loanorigination.event.CounterOfferSent;
import com.loanorigination.event.LifecycleEvent;
import com.loanorigination.exception.LendingException;
import com.loanorigination.model.OutboxEvent;
import com.loanorigination.repository.OutboxEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Stores lifecycle events in the outbox table. Must run inside the caller's
 * transaction so the event commits together with the application change.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxEventWriter {

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;

    public void write(LifecycleEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} {} for outbox", event.eventType(), event.eventId(), e);
            throw new LendingException("Failed to save event to outbox", e);
        }

        OutboxEvent outboxEvent = new OutboxEvent();
        outboxEvent.setEventId(event.eventId());
        outboxEvent.setApplicationId(event.applicationId());
        outboxEvent.setTenantId(event.tenantId());
        outboxEvent.setEventType(event.eventType());
        outboxEvent.setPayload(payload);
        outboxEvent.setTopic(topicFor(event));
        outboxEvent.setCreatedAt(event.timestamp());

        outboxEventRepository.save(outboxEvent);
        log.debug("Saved {} {} to outbox", event.eventType(), event.eventId());
    }

    static String topicFor(LifecycleEvent event) {
        if (event instanceof ApplicationStatusChanged) {
            return KafkaTopics.APPLICATION_STATUS_CHANGED;
        }
        if (event instanceof CounterOfferSent) {
            return KafkaTopics.COUNTER_OFFER_SENT;
        }
        if (event instanceof CounterOfferResponded) {
            return KafkaTopics.COUNTER_OFFER_RESPONDED;
        }
        throw new IllegalArgumentException("No topic for event type: " + event.eventType());
    }
}
