package com.example.striprequest.service.processor;

import com.example.striprequest.model.ProbeOutcome;
import com.example.striprequest.model.ResponseFingerprint;
import org.springframework.stereotype.Component;

/**
 * Response equivalence: same content length, status code and status message. Headers are ignored since
 * dates, cache nodes and trace ids differ between otherwise identical responses.
 */
@Component
public class FingerprintMatcher {

    public boolean matches(ResponseFingerprint baseline, ResponseFingerprint candidate) {
        if (baseline == null || candidate == null) {
            return false;
        }
        return baseline.contentLength() == candidate.contentLength()
                && baseline.statusCode() == candidate.statusCode()
                && baseline.statusMessage().equals(candidate.statusMessage());
    }

    /** A failed probe never matches. */
    public boolean matches(ResponseFingerprint baseline, ProbeOutcome candidate) {
        return candidate != null && candidate.succeeded() && matches(baseline, candidate.fingerprint());
    }
}
