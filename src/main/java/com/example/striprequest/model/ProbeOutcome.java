package com.example.striprequest.model;

import java.util.Objects;

/**
 * Result of sending one request: either a fingerprint or a description of why none could be obtained.
 */
public record ProbeOutcome(ResponseFingerprint fingerprint, String error) {

    public static ProbeOutcome success(ResponseFingerprint fingerprint) {
        return new ProbeOutcome(Objects.requireNonNull(fingerprint, "fingerprint"), null);
    }

    public static ProbeOutcome failure(String error) {
        return new ProbeOutcome(null, Objects.requireNonNull(error, "error"));
    }

    public boolean succeeded() {
        return fingerprint != null;
    }
}
