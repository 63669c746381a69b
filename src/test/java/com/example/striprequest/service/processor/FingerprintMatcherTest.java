package com.example.striprequest.service.processor;

import com.example.striprequest.model.ProbeOutcome;
import com.example.striprequest.model.ResponseFingerprint;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FingerprintMatcherTest {

    private final FingerprintMatcher matcher = new FingerprintMatcher();

    private static ResponseFingerprint fingerprint(Map<String, String> headers, int length, int code, String message) {
        return new ResponseFingerprint(headers, length, code, message);
    }

    @Test
    void headersDoNotAffectEquivalence() {
        ResponseFingerprint a = fingerprint(Map.of("Date", "Mon", "X-Trace", "1"), 10, 200, "OK");
        ResponseFingerprint b = fingerprint(Map.of("Date", "Tue"), 10, 200, "OK");

        assertTrue(matcher.matches(a, b));
    }

    @Test
    void eachFingerprintFieldMatters() {
        ResponseFingerprint base = fingerprint(Map.of(), 10, 200, "OK");

        assertFalse(matcher.matches(base, fingerprint(Map.of(), 11, 200, "OK")));
        assertFalse(matcher.matches(base, fingerprint(Map.of(), 10, 302, "OK")));
        assertFalse(matcher.matches(base, fingerprint(Map.of(), 10, 200, "Ok")));
    }

    @Test
    void failedProbeNeverMatches() {
        ResponseFingerprint base = fingerprint(Map.of(), 0, 200, "OK");

        assertFalse(matcher.matches(base, ProbeOutcome.failure("Connection error")));
        assertFalse(matcher.matches(base, (ProbeOutcome) null));
        assertTrue(matcher.matches(base, ProbeOutcome.success(fingerprint(Map.of(), 0, 200, "OK"))));
    }
}
