package com.company.signals.controller;

import com.company.signals.config.SignalsProperties;
import com.company.signals.dto.response.TriageResponse;
import com.company.signals.exception.GlobalExceptionHandler;
import com.company.signals.security.WebhookSignatureVerifier;
import com.company.signals.service.TriageService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class SentryWebhookControllerTest {

    private static final String BODY =
            "{\"action\":\"triggered\",\"data\":{\"issue\":{\"id\":\"42\",\"title\":\"Boom\"}}}";

    @Mock
    private TriageService triageService;

    private WebhookSignatureVerifier verifier;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        SignalsProperties properties = new SignalsProperties();
        properties.getWebhook().setSentrySecret("s3cret");
        verifier = new WebhookSignatureVerifier(properties);
        SentryWebhookController controller = new SentryWebhookController(verifier, triageService, new ObjectMapper());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void signedPayloadIsTriaged() throws Exception {
        when(triageService.handle(any())).thenReturn(TriageResponse.builder()
                .accepted(true)
                .action(TriageResponse.TRIAGED)
                .issueId("42")
                .build());

        mockMvc.perform(post("/webhooks/sentry")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("sentry-hook-signature", verifier.sign(BODY.getBytes(StandardCharsets.UTF_8)))
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.action").value("triaged"))
                .andExpect(jsonPath("$.issueId").value("42"));
    }

    @Test
    void badSignatureIsUnauthorized() throws Exception {
        mockMvc.perform(post("/webhooks/sentry")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("sentry-hook-signature", "deadbeef")
                        .content(BODY))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Invalid signature"));

        verifyNoInteractions(triageService);
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        String body = "{not json";

        mockMvc.perform(post("/webhooks/sentry")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("sentry-hook-signature", verifier.sign(body.getBytes(StandardCharsets.UTF_8)))
                        .content(body))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(triageService);
    }
}
