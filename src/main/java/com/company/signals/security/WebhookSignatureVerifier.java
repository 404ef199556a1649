package com.company.signals.security;

import com.company.signals.config.SignalsProperties;
import com.company.signals.exception.InvalidWebhookSignatureException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Checks the {@code sentry-hook-signature} header: hex HMAC-SHA256 of the raw body,
 * optionally prefixed with {@code sha256=}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class WebhookSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";
    private static final String PREFIX = "sha256=";

    private final SignalsProperties properties;

    public boolean isEnabled() {
        String secret = properties.getWebhook().getSentrySecret();
        return secret != null && !secret.isBlank();
    }

    /**
     * @throws InvalidWebhookSignatureException when a secret is configured and the signature does not match
     */
    public void verify(byte[] rawBody, String signatureHeader) {
        if (!isEnabled()) {
            log.debug("No webhook secret configured, skipping signature verification");
            return;
        }
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new InvalidWebhookSignatureException();
        }

        String received = signatureHeader.trim();
        if (received.startsWith(PREFIX)) {
            received = received.substring(PREFIX.length());
        }
        byte[] expected = sign(rawBody).getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expected, received.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII))) {
            throw new InvalidWebhookSignatureException();
        }
    }

    /**
     * Lowercase hex HMAC-SHA256 of the body under the configured secret, as Sentry sends it
     */
    public String sign(byte[] rawBody) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(
                    properties.getWebhook().getSentrySecret().getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(rawBody));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }
}
