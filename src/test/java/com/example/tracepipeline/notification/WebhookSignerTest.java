package com.example.tracepipeline.notification;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class WebhookSignerTest {

    private final WebhookSigner signer = new WebhookSigner();

    @Test
    void testKnownVector() {
        assertEquals("sha256=f7bc83f430538424b13298e6aa6fb143ef4d59a14946175997479dbc2d1a3cd8",
                signer.sign("The quick brown fox jumps over the lazy dog", "key"));
    }

    @Test
    void testDifferentSecretDifferentSignature() {
        assertNotEquals(signer.sign("{\"a\":1}", "one"), signer.sign("{\"a\":1}", "two"));
    }
}
