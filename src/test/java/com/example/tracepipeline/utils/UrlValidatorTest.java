package com.example.tracepipeline.utils;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UrlValidatorTest {

    private final UrlValidator validator = new UrlValidator(true,
            "127.0.0.1,localhost,10.0.0.0/8,172.16.0.0/12,192.168.0.0/16,169.254.169.254");

    @Test
    void testSafeUrls() {
        assertTrue(validator.isSafeUrl("https://1.1.1.1"));
        assertTrue(validator.isSafeUrl("http://8.8.8.8/webhook"));
    }

    @Test
    void testUnsafeProtocols() {
        assertFalse(validator.isSafeUrl("ftp://example.com/file"));
        assertFalse(validator.isSafeUrl("file:///etc/passwd"));
        assertFalse(validator.isSafeUrl("gopher://example.com"));
    }

    @Test
    void testBlockedIps() {
        assertFalse(validator.isSafeUrl("http://localhost:8080"));
        assertFalse(validator.isSafeUrl("http://127.0.0.1:8080"));
        assertFalse(validator.isSafeUrl("http://192.168.1.1"));
        assertFalse(validator.isSafeUrl("http://10.0.0.5"));
        assertFalse(validator.isSafeUrl("http://172.20.1.1"));
        assertFalse(validator.isSafeUrl("http://169.254.169.254/latest/meta-data"));
        assertFalse(validator.isSafeUrl("http://0.0.0.0"));
    }

    @Test
    void testIpv6Loopback() {
        assertFalse(validator.isSafeUrl("http://[::1]"));
    }

    @Test
    void testValidateReturnsNormalizedUri() {
        URI uri = validator.validate("https://1.1.1.1/a/../hook");
        assertEquals("/hook", uri.getPath());
    }

    @Test
    void testDisabledStillChecksScheme() {
        UrlValidator permissive = new UrlValidator(false, "");
        assertTrue(permissive.isSafeUrl("http://127.0.0.1:8080/hook"));
        assertThrows(IllegalArgumentException.class, () -> permissive.validate("file:///etc/passwd"));
        assertThrows(IllegalArgumentException.class, () -> permissive.validate("http:///no-host"));
    }
}
