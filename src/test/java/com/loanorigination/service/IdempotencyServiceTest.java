package com.loanorigination.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("IdempotencyService Unit Tests")
class IdempotencyServiceTest {

    private static final String CONSUMER = "ApplicationNotificationConsumer";
    private static final String KEY = "idempotency:ApplicationNotificationConsumer:evt-1";

    @Mock
    private RedisTemplate<String, Object> redisTemplate;

    @Mock
    private ValueOperations<String, Object> valueOperations;

    private IdempotencyService idempotencyService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);
        idempotencyService = new IdempotencyService(redisTemplate, clock);
    }

    @Test
    @DisplayName("Should claim an unseen event for seven days")
    void shouldClaimNewEvent() {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(KEY, "ApplicationStatusChanged@1700000000000", Duration.ofDays(7)))
                .thenReturn(true);

        // When / Then
        assertThat(idempotencyService.claim(CONSUMER, "ApplicationStatusChanged", "evt-1")).isTrue();
    }

    @Test
    @DisplayName("Should refuse an event the consumer already claimed")
    void shouldRefuseClaimedEvent() {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(eq(KEY), anyString(), any(Duration.class))).thenReturn(false);

        // When / Then
        assertThat(idempotencyService.claim(CONSUMER, "ApplicationStatusChanged", "evt-1")).isFalse();
    }

    @Test
    @DisplayName("Should handle the event when Redis is unavailable")
    void shouldGrantClaimWhenRedisIsDown() {
        // Given
        when(redisTemplate.opsForValue()).thenThrow(new RedisConnectionFailureException("down"));

        // When / Then
        assertThat(idempotencyService.claim(CONSUMER, "ApplicationStatusChanged", "evt-1")).isTrue();
    }

    @Test
    @DisplayName("Should delete the claim on release")
    void shouldReleaseClaim() {
        // When
        idempotencyService.release(CONSUMER, "evt-1");

        // Then
        verify(redisTemplate).delete(KEY);
    }

    @Test
    @DisplayName("Release should not throw when Redis is unavailable")
    void releaseShouldTolerateRedisFailure() {
        // Given
        when(redisTemplate.delete(KEY)).thenThrow(new RedisConnectionFailureException("down"));

        // When / Then
        assertThatCode(() -> idempotencyService.release(CONSUMER, "evt-1")).doesNotThrowAnyException();
    }
}
