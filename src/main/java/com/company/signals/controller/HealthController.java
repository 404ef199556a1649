package com.company.signals.controller;

import com.company.signals.cache.AutoResolveRateLimiter;
import com.company.signals.util.TimeUtils;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/health")
@Slf4j
@Tag(name = "Health", description = "Health check endpoints")
public class HealthController {

    private final AutoResolveRateLimiter rateLimiter;
    private final Clock clock;
    private final Instant startedAt;

    public HealthController(AutoResolveRateLimiter rateLimiter, Clock clock) {
        this.rateLimiter = rateLimiter;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    @GetMapping
    @Operation(summary = "Health check with auto-resolve usage for the current hour")
    public ResponseEntity<Map<String, Object>> health() {
        long uptimeMs = clock.millis() - startedAt.toEpochMilli();

        Map<String, Object> response = new HashMap<>();
        response.put("status", "UP");
        response.put("timestamp", clock.instant());
        response.put("service", "signal-analysis-service");
        response.put("uptimeSeconds", uptimeMs / 1000);
        response.put("uptime", TimeUtils.formatDuration(uptimeMs));
        response.put("maxAutoResolvePerHour", rateLimiter.getMaxPerHour());
        try {
            response.put("autoResolveCount", rateLimiter.countInWindow());
        } catch (Exception e) {
            log.warn("Auto-resolve window unavailable: {}", e.getMessage());
            response.put("autoResolveCount", null);
        }

        return ResponseEntity.ok(response);
    }
}
