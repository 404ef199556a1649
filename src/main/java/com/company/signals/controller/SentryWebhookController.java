package com.company.signals.controller;

import com.company.signals.dto.response.TriageResponse;
import com.company.signals.security.WebhookSignatureVerifier;
import com.company.signals.service.TriageService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;

@RestController
@RequestMapping("/webhooks")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Webhooks", description = "Error-tracker alert intake")
public class SentryWebhookController {

    private final WebhookSignatureVerifier signatureVerifier;
    private final TriageService triageService;
    private final ObjectMapper objectMapper;

    @PostMapping(value = "/sentry", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Receive a Sentry alert and triage the issue")
    public ResponseEntity<TriageResponse> sentryWebhook(
            @RequestBody byte[] rawBody,
            @RequestHeader(value = "sentry-hook-signature", required = false) String signature) throws IOException {

        // signature covers the exact bytes sent, so verify before parsing
        signatureVerifier.verify(rawBody, signature);

        JsonNode payload = objectMapper.readTree(rawBody);
        return ResponseEntity.ok(triageService.handle(payload));
    }
}
