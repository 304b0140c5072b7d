package com.dsync.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Checks the {@code X-Hub-Signature-256} header GitHub sends with each webhook delivery.
 * Without a configured secret every delivery is accepted.
 */
@Component
public class WebhookSignatureVerifier {

    private static final Logger log = LoggerFactory.getLogger(WebhookSignatureVerifier.class);

    private static final String PREFIX = "sha256=";

    private final String secret;

    public WebhookSignatureVerifier(@Value("${github.webhook.secret:}") String secret) {
        this.secret = secret == null ? "" : secret.trim();
        if (this.secret.isEmpty()) {
            log.warn("github.webhook.secret is not set, webhook deliveries are not authenticated");
        }
    }

    public boolean isEnabled() {
        return !secret.isEmpty();
    }

    public boolean verify(byte[] payload, String signatureHeader) {
        if (!isEnabled()) {
            return true;
        }
        if (signatureHeader == null || !signatureHeader.startsWith(PREFIX)) {
            return false;
        }
        byte[] expected = sign(payload).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = signatureHeader.getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, actual);
    }

    String sign(byte[] payload) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return PREFIX + HexFormat.of().formatHex(mac.doFinal(payload));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 is not available", e);
        }
    }
}
