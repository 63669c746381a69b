package com.example.striprequest.service;

import com.example.striprequest.model.ProbeOutcome;
import com.example.striprequest.model.ProbeTarget;
import com.example.striprequest.model.RemovalDescriptor;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Everything one strip run produced. When the baseline probe failed only {@link #target()},
 * {@link #originalRequest()}, {@link #requestedHost()} and {@link #baseline()} are meaningful.
 * {@code requestedHost} is the captured {@code Host} header, which may name a different host than the
 * target the probes were sent to.
 */
public record StripReport(ProbeTarget target,
                          String originalRequest,
                          String requestedHost,
                          ProbeOutcome baseline,
                          String strippedRequest,
                          ProbeOutcome strippedResponse,
                          List<RemovalDescriptor> removed,
                          int candidates,
                          long failedProbes,
                          Instant startedAt,
                          Duration elapsed) {

    public StripReport {
        removed = removed != null ? List.copyOf(removed) : List.of();
    }

    static StripReport baselineFailed(ProbeTarget target, String originalRequest, String requestedHost,
                                      ProbeOutcome baseline, Instant startedAt) {
        return new StripReport(target, originalRequest, requestedHost, baseline, null, null, List.of(), 0, 0,
                startedAt, Duration.between(startedAt, Instant.now()));
    }

    public boolean completed() {
        return baseline.succeeded();
    }
}
