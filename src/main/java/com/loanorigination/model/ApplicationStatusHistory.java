package com.loanorigination.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * One row per status change. Rows are written once and never updated.
 */
@Entity
@Immutable
@Table(name = "application_status_history",
       indexes = {
           @Index(name = "idx_history_application", columnList = "applicationId,createdAt")
       })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ApplicationStatusHistory {

    @Id
    private String id;

    @Column(nullable = false)
    private String applicationId;

    @Enumerated(EnumType.STRING)
    private ApplicationStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ApplicationStatus toStatus;

    private String changedBy;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ActorType changedByType;

    @Column(length = 2000)
    private String notes;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    static ApplicationStatusHistory of(String applicationId,
                                       ApplicationStatus fromStatus,
                                       ApplicationStatus toStatus,
                                       Actor actor,
                                       String notes,
                                       Instant at) {
        ApplicationStatusHistory entry = new ApplicationStatusHistory();
        entry.id = UUID.randomUUID().toString();
        entry.applicationId = applicationId;
        entry.fromStatus = fromStatus;
        entry.toStatus = toStatus;
        entry.changedBy = actor.id();
        entry.changedByType = actor.type();
        entry.notes = notes;
        entry.createdAt = at;
        return entry;
    }
}
