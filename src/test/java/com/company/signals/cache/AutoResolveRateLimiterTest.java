package com.company.signals.cache;

import com.company.signals.config.SignalsProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AutoResolveRateLimiterTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Mock
    private RedisTemplate<String, Object> redisTemplate;

    @Mock
    private ZSetOperations<String, Object> zSetOperations;

    private AutoResolveRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        SignalsProperties properties = new SignalsProperties();
        properties.getAutoResolve().setMaxAutoResolvePerHour(3);
        rateLimiter = new AutoResolveRateLimiter(redisTemplate, properties, Clock.fixed(NOW, ZoneOffset.UTC));
        when(redisTemplate.opsForZSet()).thenReturn(zSetOperations);
    }

    @Test
    void allowsWhileBelowLimit() {
        when(zSetOperations.zCard(AutoResolveRateLimiter.WINDOW_ZSET)).thenReturn(2L);

        assertThat(rateLimiter.canResolve()).isTrue();
        verify(zSetOperations).removeRangeByScore(
                AutoResolveRateLimiter.WINDOW_ZSET, 0, NOW.minus(Duration.ofHours(1)).toEpochMilli());
    }

    @Test
    void refusesAtLimit() {
        when(zSetOperations.zCard(AutoResolveRateLimiter.WINDOW_ZSET)).thenReturn(3L);

        assertThat(rateLimiter.canResolve()).isFalse();
    }

    @Test
    void refusesWhenRedisIsDown() {
        when(zSetOperations.removeRangeByScore(
                AutoResolveRateLimiter.WINDOW_ZSET, 0, NOW.minus(Duration.ofHours(1)).toEpochMilli()))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThat(rateLimiter.canResolve()).isFalse();
    }

    @Test
    void recordsResolutionWithTimestampScore() {
        rateLimiter.record("42", "validation_error");

        long millis = NOW.toEpochMilli();
        verify(zSetOperations).add(AutoResolveRateLimiter.WINDOW_ZSET, "42:validation_error:" + millis, millis);
        verify(redisTemplate).expire(AutoResolveRateLimiter.WINDOW_ZSET, Duration.ofHours(2));
    }
}
