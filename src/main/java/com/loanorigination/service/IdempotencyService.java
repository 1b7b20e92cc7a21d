package com.loanorigination.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Redis claim per (consumer, event) so a Kafka redelivery does not send the
 * same applicant notification twice.
 *
 * KEYS:
 * =====
 * idempotency:{consumer}:{eventId}, value "{eventType}@{epochMillis}".
 * Each consumer claims events on its own, so two listeners on one topic do
 * not block each other. Claims expire after 7 days, Kafka's default retention.
 *
 * REDIS DOWN:
 * ===========
 * The claim is granted. A duplicate notification is preferred over a lost one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotencyService {

    static final Duration CLAIM_TTL = Duration.ofDays(7);
    private static final String KEY_PREFIX = "idempotency:";

    private final RedisTemplate<String, Object> redisTemplate;
    private final Clock clock;

    /**
     * Claim an event for a consumer with SET NX.
     *
     * @return true when the caller should handle the event, false when it was already handled
     */
    public boolean claim(String consumer, String eventType, String eventId) {
        String key = key(consumer, eventId);
        try {
            Boolean claimed = redisTemplate.opsForValue()
                    .setIfAbsent(key, eventType + "@" + clock.millis(), CLAIM_TTL);
            if (Boolean.TRUE.equals(claimed)) {
                return true;
            }
            log.info("{} already handled {} {}", consumer, eventType, eventId);
            return false;
        } catch (Exception e) {
            log.error("Redis unavailable while claiming {} {} for {}, handling it anyway",
                    eventType, eventId, consumer, e);
            return true;
        }
    }

    /**
     * Drop a claim after the handler failed, so the redelivered event is handled again.
     */
    public void release(String consumer, String eventId) {
        try {
            redisTemplate.delete(key(consumer, eventId));
        } catch (Exception e) {
            log.error("Could not release claim on {} for {}; the redelivery will be skipped until {} passes",
                    eventId, consumer, CLAIM_TTL, e);
        }
    }

    private static String key(String consumer, String eventId) {
        return KEY_PREFIX + consumer + ":" + eventId;
    }
}
