package com.loanorigination.producer;

import com.loanorigination.event.LifecycleEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;

/**
 * Sends lifecycle events to Kafka.
 *
 * RECORD LAYOUT:
 * ==============
 * - key: application ID, so one application's events share a partition
 * - timestamp: when the lifecycle change happened, not when the outbox sent it
 * - headers: tenant ID and event type, for routing without reading the payload
 *
 * The future completes on broker acknowledgement; the outbox publisher waits on it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventProducer {

    public static final String TENANT_HEADER = "tenant-id";
    public static final String EVENT_TYPE_HEADER = "event-type";

    private final KafkaTemplate<String, Object> kafkaTemplate;

    public CompletableFuture<SendResult<String, Object>> publish(String topic, LifecycleEvent event) {
        ProducerRecord<String, Object> record = new ProducerRecord<>(
                topic, null, event.timestamp().toEpochMilli(), event.applicationId(), event);
        if (event.tenantId() != null) {
            record.headers().add(TENANT_HEADER, event.tenantId().getBytes(StandardCharsets.UTF_8));
        }
        record.headers().add(EVENT_TYPE_HEADER, event.eventType().getBytes(StandardCharsets.UTF_8));

        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(record);
        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to send {} {} for application {} to {}",
                        event.eventType(), event.eventId(), event.applicationId(), topic, ex);
            } else {
                log.debug("{} {} acknowledged on {}-{}@{}",
                        event.eventType(), event.eventId(), topic,
                        result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
            }
        });
        return future;
    }
}
