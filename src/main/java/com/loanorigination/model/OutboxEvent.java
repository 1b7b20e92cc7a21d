package com.loanorigination.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Lifecycle event waiting in the application outbox.
 *
 * Rows are written in the same transaction as the application change that
 * produced them and shipped to Kafka afterwards by {@code OutboxEventPublisher}.
 * A row is never deleted; {@link #markPublished} and {@link #recordFailure}
 * are the only state changes after insert.
 */
@Entity
@Table(name = "application_outbox",
       indexes = {
           @Index(name = "idx_outbox_pending", columnList = "published,createdAt"),
           @Index(name = "idx_outbox_application", columnList = "applicationId")
       })
@Getter
@Setter
@NoArgsConstructor
public class OutboxEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String eventId;

    /** Kafka record key, keeps one application's events on one partition. */
    @Column(nullable = false)
    private String applicationId;

    private String tenantId;

    /** Simple name of the event record, used to rebuild it from the payload. */
    @Column(nullable = false)
    private String eventType;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(nullable = false)
    private String topic;

    @Column(nullable = false)
    @Setter(AccessLevel.NONE)
    private boolean published;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Setter(AccessLevel.NONE)
    private Instant publishedAt;

    @Column(nullable = false)
    @Setter(AccessLevel.NONE)
    private int attempts;

    @Setter(AccessLevel.NONE)
    private Instant lastAttemptAt;

    @Column(columnDefinition = "TEXT")
    @Setter(AccessLevel.NONE)
    private String lastError;

    public void markPublished(Instant at) {
        this.published = true;
        this.publishedAt = at;
        this.attempts++;
        this.lastAttemptAt = at;
        this.lastError = null;
    }

    public void recordFailure(String error, Instant at) {
        this.attempts++;
        this.lastAttemptAt = at;
        this.lastError = error;
    }
}
