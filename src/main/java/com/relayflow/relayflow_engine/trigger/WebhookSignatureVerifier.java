package com.relayflow.relayflow_engine.trigger;

import com.relayflow.relayflow_engine.exception.WebhookVerificationException;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Checks {@code sha256=<hex>} signatures: HMAC-SHA256 of the raw request body keyed with
 * the trigger secret. Comparison is constant time.
 */
@Component
public class WebhookSignatureVerifier {

    private static final String PREFIX = "sha256=";
    private static final String ALGORITHM = "HmacSHA256";

    public void verify(String secret, String signatureHeader, byte[] rawBody) {
        if (signatureHeader == null || !signatureHeader.startsWith(PREFIX)) {
            throw new WebhookVerificationException("Missing or malformed webhook signature");
        }
        byte[] expected = sign(secret, rawBody);
        byte[] provided;
        try {
            provided = HexFormat.of().parseHex(signatureHeader.substring(PREFIX.length()).trim());
        } catch (IllegalArgumentException ex) {
            throw new WebhookVerificationException("Webhook signature is not hex encoded");
        }
        if (!MessageDigest.isEqual(expected, provided)) {
            throw new WebhookVerificationException("Webhook signature does not match");
        }
    }

    public String signatureFor(String secret, byte[] rawBody) {
        return PREFIX + HexFormat.of().formatHex(sign(secret, rawBody));
    }

    private static byte[] sign(String secret, byte[] rawBody) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return mac.doFinal(rawBody != null ? rawBody : new byte[0]);
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("HmacSHA256 unavailable", ex);
        }
    }
}
