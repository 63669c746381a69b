package com.example.striprequest.service;

import com.example.striprequest.codec.HttpMessageCodec;
import com.example.striprequest.model.ProbeOutcome;
import com.example.striprequest.model.ProbeTarget;
import com.example.striprequest.model.Request;
import com.example.striprequest.model.ResponseFingerprint;
import com.example.striprequest.service.processor.RequestMinimizer;
import com.example.striprequest.service.processor.RequestMinimizer.Minimization;
import com.example.striprequest.service.processor.RequestProber;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point used by the CLI and the REST layer: parse a captured request, take a baseline, minimize,
 * and re-probe the minimized request once for reference.
 */
@Service
public class StripRequestService {

    private static final Logger log = LoggerFactory.getLogger(StripRequestService.class);

    private final HttpMessageCodec codec;
    private final RequestProber prober;
    private final RequestMinimizer minimizer;

    public StripRequestService(HttpMessageCodec codec, RequestProber prober, RequestMinimizer minimizer) {
        this.codec = codec;
        this.prober = prober;
        this.minimizer = minimizer;
    }

    public Request parse(String rawRequest) {
        return codec.parse(rawRequest);
    }

    public String serialize(Request request) {
        return codec.serialize(request);
    }

    /** Sends the captured text unchanged; the result is the fingerprint every variant is compared with. */
    public ProbeOutcome probeBaseline(ProbeTarget target, String rawRequest) {
        return prober.probeRaw(target, rawRequest);
    }

    public Request minimize(Request baseRequest, ResponseFingerprint baseline, ProbeTarget target) {
        return minimizer.minimize(baseRequest, baseline, target).minimized();
    }

    public StripReport strip(ProbeTarget target, String rawRequest) {
        Objects.requireNonNull(target, "Target cannot be null");
        Objects.requireNonNull(rawRequest, "Request cannot be null");
        Instant startedAt = Instant.now();
        Request base = parse(rawRequest);
        String requestedHost = base.getHost();

        ProbeOutcome baseline = probeBaseline(target, rawRequest);
        if (!baseline.succeeded()) {
            log.warn("Baseline probe to {} (Host: {}) failed: {}", target.authority(), requestedHost,
                    baseline.error());
            return StripReport.baselineFailed(target, rawRequest, requestedHost, baseline, startedAt);
        }
        log.info("Baseline from {}: {} {} (content-length {})", target.authority(),
                baseline.fingerprint().statusCode(), baseline.fingerprint().statusMessage(),
                baseline.fingerprint().contentLength());

        Minimization minimization = minimizer.minimize(base, baseline.fingerprint(), target);
        String stripped = serialize(minimization.minimized());
        ProbeOutcome strippedResponse = prober.probeRaw(target, stripped);

        return new StripReport(target,
                rawRequest,
                requestedHost,
                baseline,
                stripped,
                strippedResponse,
                minimization.accepted(),
                minimization.results().size(),
                minimization.failedProbes(),
                startedAt,
                Duration.between(startedAt, Instant.now()));
    }
}
