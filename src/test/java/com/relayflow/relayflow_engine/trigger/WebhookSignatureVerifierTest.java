package com.relayflow.relayflow_engine.trigger;

import com.relayflow.relayflow_engine.exception.WebhookVerificationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

public class WebhookSignatureVerifierTest {

    private final WebhookSignatureVerifier verifier = new WebhookSignatureVerifier();
    private final byte[] body = "{\"action\":\"opened\"}".getBytes(StandardCharsets.UTF_8);

    @Test
    public void shouldAcceptMatchingSignature() {
        String signature = verifier.signatureFor("s3cr3t", body);

        Assertions.assertTrue(signature.startsWith("sha256="));
        Assertions.assertDoesNotThrow(() -> verifier.verify("s3cr3t", signature, body));
    }

    @Test
    public void shouldMatchKnownDigest() {
        // HMAC-SHA256("key", "The quick brown fox jumps over the lazy dog")
        byte[] fox = "The quick brown fox jumps over the lazy dog".getBytes(StandardCharsets.UTF_8);

        Assertions.assertEquals("sha256=f7bc83f430538424b13298e6aa6fb143ef4d59a14946175997479dbc2d1a3cd8",
                verifier.signatureFor("key", fox));
    }

    @Test
    public void shouldRejectWrongSecretOrTamperedBody() {
        String signature = verifier.signatureFor("s3cr3t", body);
        byte[] tampered = "{\"action\":\"closed\"}".getBytes(StandardCharsets.UTF_8);

        Assertions.assertThrows(WebhookVerificationException.class, () -> verifier.verify("other", signature, body));
        Assertions.assertThrows(WebhookVerificationException.class, () -> verifier.verify("s3cr3t", signature, tampered));
    }

    @Test
    public void shouldRejectMissingOrMalformedHeader() {
        Assertions.assertThrows(WebhookVerificationException.class, () -> verifier.verify("s3cr3t", null, body));
        Assertions.assertThrows(WebhookVerificationException.class, () -> verifier.verify("s3cr3t", "md5=abc", body));
        Assertions.assertThrows(WebhookVerificationException.class, () -> verifier.verify("s3cr3t", "sha256=zz", body));
    }
}
