package com.loanorigination.service;

import com.loanorigination.event.ApplicationStatusChanged;
import com.loanorigination.event.CounterOfferResponded;
import com.loanorigination.event.CounterOfferSent;
import com.loanorigination.event.LifecycleEvent;
import com.loanorigination.model.OutboxEvent;
import com.loanorigination.producer.EventProducer;
import com.loanorigination.repository.OutboxEventRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * OUTBOX PUBLISHER
 * ================
 *
 * Ships lifecycle events from the application outbox to Kafka.
 *
 * EACH POLL:
 * ----------
 * 1. Lock a batch of pending rows that still have attempts left
 * 2. Rebuild each event record from its JSON payload
 * 3. Send it keyed by application ID and wait for the broker ack
 * 4. Mark the row published, or record the failure and move on
 *
 * Rows that reach the attempt limit are parked: they stay pending but are no
 * longer polled, and the monitor reports them until someone resets them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxEventPublisher {

    static final Map<String, Class<? extends LifecycleEvent>> PAYLOAD_TYPES = Map.of(
            ApplicationStatusChanged.class.getSimpleName(), ApplicationStatusChanged.class,
            CounterOfferSent.class.getSimpleName(), CounterOfferSent.class,
            CounterOfferResponded.class.getSimpleName(), CounterOfferResponded.class
    );

    private static final Duration STUCK_THRESHOLD = Duration.ofMinutes(5);
    private static final long HIGH_QUEUE_SIZE = 1000;

    private final OutboxEventRepository outboxEventRepository;
    private final EventProducer eventProducer;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Value("${lending.outbox.batch-size:100}")
    private int batchSize = 100;

    @Value("${lending.outbox.send-timeout-seconds:10}")
    private long sendTimeoutSeconds = 10;

    @Value("${lending.outbox.max-attempts:10}")
    private int maxAttempts = 10;

    @Scheduled(fixedDelayString = "${lending.outbox.poll-interval-ms:100}")
    @Transactional
    public void publishPending() {
        List<OutboxEvent> batch = outboxEventRepository.lockPendingBatch(batchSize, maxAttempts);
        if (batch.isEmpty()) {
            return;
        }

        int sent = 0;
        for (OutboxEvent row : batch) {
            if (send(row)) {
                sent++;
            }
        }
        log.debug("Outbox poll: {} of {} events sent", sent, batch.size());
    }

    private boolean send(OutboxEvent row) {
        Class<? extends LifecycleEvent> type = PAYLOAD_TYPES.get(row.getEventType());
        if (type == null) {
            fail(row, "Unknown event type: " + row.getEventType());
            return false;
        }

        try {
            LifecycleEvent event = objectMapper.readValue(row.getPayload(), type);
            eventProducer.publish(row.getTopic(), event).get(sendTimeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(row, "Interrupted while sending");
            return false;
        } catch (ExecutionException e) {
            fail(row, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return false;
        } catch (Exception e) {
            fail(row, e.getMessage());
            return false;
        }

        row.markPublished(clock.instant());
        outboxEventRepository.save(row);
        log.info("Sent {} {} for application {} to {}",
                row.getEventType(), row.getEventId(), row.getApplicationId(), row.getTopic());
        return true;
    }

    private void fail(OutboxEvent row, String error) {
        row.recordFailure(error, clock.instant());
        outboxEventRepository.save(row);

        if (row.getAttempts() >= maxAttempts) {
            log.error("Parking outbox event {} ({}) for application {} after {} attempts: {}",
                    row.getEventId(), row.getEventType(), row.getApplicationId(), row.getAttempts(), error);
        } else {
            log.warn("Could not send outbox event {} (attempt {}): {}",
                    row.getEventId(), row.getAttempts(), error);
        }
    }

    @Scheduled(fixedDelay = 60000)
    public void monitorStuckEvents() {
        Instant threshold = clock.instant().minus(STUCK_THRESHOLD);
        List<OutboxEvent> stuck = outboxEventRepository.findByPublishedFalseAndCreatedAtBefore(threshold);

        for (OutboxEvent row : stuck) {
            log.error("Outbox event {} ({}) for application {} pending since {}: attempts={}, lastError={}",
                    row.getEventId(), row.getEventType(), row.getApplicationId(),
                    row.getCreatedAt(), row.getAttempts(), row.getLastError());
        }

        long pending = outboxEventRepository.countByPublishedFalse();
        if (pending > HIGH_QUEUE_SIZE) {
            log.warn("Outbox backlog is {} events", pending);
        }
    }
}
