package com.company.signals.service;

import com.company.signals.config.SignalsProperties;
import com.company.signals.domain.CheckResult;
import com.company.signals.exception.NotificationSendException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Posts failing periodic check results to a chat webhook as {@code {"text": ...}}
 */
@Component
@Slf4j
public class NotificationSender {

    static final String HEADER = "Signal Analysis Alert";

    private final RestClient restClient;
    private final SignalsProperties properties;
    private final Tracer tracer;
    private final MeterRegistry meterRegistry;

    public NotificationSender(RestClient.Builder restClientBuilder,
                              SignalsProperties properties,
                              Tracer tracer,
                              MeterRegistry meterRegistry) {
        this.restClient = restClientBuilder.build();
        this.properties = properties;
        this.tracer = tracer;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Only non-ok results are sent; nothing is posted when every check passed
     */
    @CircuitBreaker(name = "notifications", fallbackMethod = "notifyFallback")
    public void sendFailures(List<CheckResult> results) {
        String url = properties.getPeriodicChecks().getNotifyUrl();
        List<CheckResult> problems = results.stream()
                .filter(result -> !result.isOk())
                .collect(Collectors.toList());
        if (url == null || url.isBlank() || problems.isEmpty()) {
            return;
        }

        Span span = tracer.spanBuilder("signals.checks.notify")
                .setSpanKind(SpanKind.CLIENT)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("checks.failing", problems.size());
            span.addEvent("Periodic checks failing",
                    Attributes.of(AttributeKey.stringKey("checks"),
                            problems.stream().map(CheckResult::getCheck).collect(Collectors.joining(","))));

            restClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("text", formatMessage(problems)))
                    .retrieve()
                    .toBodilessEntity();

            log.info("Sent notification for {} failing checks", problems.size());
        } catch (RestClientException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Failed to send notification");
            throw new NotificationSendException("Failed to send check notification", e);
        } finally {
            span.end();
        }
    }

    public void notifyFallback(List<CheckResult> results, Throwable throwable) {
        meterRegistry.counter("signals.notifications.failed").increment();
        log.error("Failed to send notification: {}", throwable.getMessage());
    }

    static String formatMessage(List<CheckResult> problems) {
        String lines = problems.stream()
                .map(p -> "*[" + p.getStatus().name().toUpperCase(Locale.ROOT) + "]* " + p.getCheck() + ": " + p.getMessage())
                .collect(Collectors.joining("\n"));
        return HEADER + "\n" + lines;
    }
}
