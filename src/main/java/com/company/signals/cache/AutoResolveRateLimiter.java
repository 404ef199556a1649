package com.company.signals.cache;

import com.company.signals.config.SignalsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Sliding one-hour window of auto-resolutions, shared by every instance through a
 * Redis sorted set scored by resolution time (epoch millis).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AutoResolveRateLimiter {

    static final String WINDOW_ZSET = "signals:autoresolve:window";
    static final Duration WINDOW = Duration.ofHours(1);

    private final RedisTemplate<String, Object> redisTemplate;
    private final SignalsProperties properties;
    private final Clock clock;

    /**
     * Fails closed: when Redis is unavailable no further auto-resolution is allowed
     */
    public boolean canResolve() {
        try {
            return countInWindow() < properties.getAutoResolve().getMaxAutoResolvePerHour();
        } catch (Exception e) {
            log.error("Auto-resolve window unavailable, refusing auto-resolve", e);
            return false;
        }
    }

    public void record(String issueId, String category) {
        long now = clock.millis();
        redisTemplate.opsForZSet().add(WINDOW_ZSET, issueId + ":" + category + ":" + now, now);
        redisTemplate.expire(WINDOW_ZSET, WINDOW.multipliedBy(2));
        log.debug("Recorded auto-resolve of issue {} ({})", issueId, category);
    }

    public long countInWindow() {
        long windowStart = clock.millis() - WINDOW.toMillis();
        redisTemplate.opsForZSet().removeRangeByScore(WINDOW_ZSET, 0, windowStart);
        Long size = redisTemplate.opsForZSet().zCard(WINDOW_ZSET);
        return size == null ? 0 : size;
    }

    public int getMaxPerHour() {
        return properties.getAutoResolve().getMaxAutoResolvePerHour();
    }
}
