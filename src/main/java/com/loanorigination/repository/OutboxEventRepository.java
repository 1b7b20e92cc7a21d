package com.loanorigination.repository;

import com.loanorigination.model.OutboxEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEvent, Long> {

    /**
     * Oldest pending rows that still have attempts left. SKIP LOCKED lets
     * several instances poll the outbox at once without sending a row twice.
     */
    @Query(value = "SELECT * FROM application_outbox WHERE published = false AND attempts < ?2 "
                 + "ORDER BY created_at ASC LIMIT ?1 FOR UPDATE SKIP LOCKED",
           nativeQuery = true)
    List<OutboxEvent> lockPendingBatch(int limit, int maxAttempts);

    List<OutboxEvent> findByPublishedFalseAndCreatedAtBefore(Instant before);

    long countByPublishedFalse();
}
