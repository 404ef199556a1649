package com.company.signals.security;

import com.company.signals.config.SignalsProperties;
import com.company.signals.exception.InvalidWebhookSignatureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebhookSignatureVerifierTest {

    private static final byte[] BODY = "{\"action\":\"triggered\"}".getBytes(StandardCharsets.UTF_8);

    private SignalsProperties properties;
    private WebhookSignatureVerifier verifier;

    @BeforeEach
    void setUp() {
        properties = new SignalsProperties();
        properties.getWebhook().setSentrySecret("s3cret");
        verifier = new WebhookSignatureVerifier(properties);
    }

    @Test
    void acceptsMatchingSignatureWithOrWithoutPrefix() {
        String signature = verifier.sign(BODY);

        assertThat(signature).hasSize(64);
        assertThatCode(() -> verifier.verify(BODY, signature)).doesNotThrowAnyException();
        assertThatCode(() -> verifier.verify(BODY, "sha256=" + signature)).doesNotThrowAnyException();
    }

    @Test
    void rejectsWrongOrMissingSignature() {
        String other = verifier.sign("{}".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> verifier.verify(BODY, other))
                .isInstanceOf(InvalidWebhookSignatureException.class)
                .hasMessage("Invalid signature");
        assertThatThrownBy(() -> verifier.verify(BODY, null))
                .isInstanceOf(InvalidWebhookSignatureException.class);
    }

    @Test
    void skipsVerificationWithoutSecret() {
        properties.getWebhook().setSentrySecret("");

        assertThat(verifier.isEnabled()).isFalse();
        assertThatCode(() -> verifier.verify(BODY, null)).doesNotThrowAnyException();
    }
}
