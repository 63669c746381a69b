package com.example.striprequest.service.processor;

import com.example.striprequest.model.ElementLocation;
import com.example.striprequest.model.ProbeOutcome;
import com.example.striprequest.model.ProbeResult;
import com.example.striprequest.model.ProbeTarget;
import com.example.striprequest.model.RemovalDescriptor;
import com.example.striprequest.model.Request;
import com.example.striprequest.model.RequestVariant;
import com.example.striprequest.model.ResponseFingerprint;
import com.example.striprequest.service.processor.executor.ProbeFanOutExecutor;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Single-level minimization: every element is removed on its own, all variants are probed concurrently,
 * and each removal whose response still matches the baseline is folded into the result.
 * <p>
 * Removals are judged independently. Elements that only matter in combination (a header that is needed
 * only when a cookie is also absent) are not detected, and the folded request is not re-validated.
 */
@Component
public class RequestMinimizer {

    private static final Logger log = LoggerFactory.getLogger(RequestMinimizer.class);

    private static final List<ElementLocation> ENUMERATION_ORDER = List.of(
            ElementLocation.QUERY_PARAMS,
            ElementLocation.PARSED_BODY,
            ElementLocation.HEADERS,
            ElementLocation.COOKIES);

    private final RequestProber prober;
    private final FingerprintMatcher matcher;

    public RequestMinimizer(RequestProber prober, FingerprintMatcher matcher) {
        this.prober = Objects.requireNonNull(prober, "prober");
        this.matcher = Objects.requireNonNull(matcher, "matcher");
    }

    public List<RequestVariant> enumerate(Request baseRequest) {
        Objects.requireNonNull(baseRequest, "baseRequest");
        List<RequestVariant> variants = new ArrayList<>();
        for (ElementLocation location : ENUMERATION_ORDER) {
            for (String key : baseRequest.elements(location).keySet()) {
                RemovalDescriptor removal = new RemovalDescriptor(key, location);
                variants.add(new RequestVariant(removal, baseRequest.without(removal)));
            }
        }
        return variants;
    }

    public List<ProbeResult> probeAll(ProbeTarget target, List<RequestVariant> variants) {
        Objects.requireNonNull(target, "target");
        return ProbeFanOutExecutor.execute(
                variants,
                variant -> new ProbeResult(variant.removal(), prober.probe(target, variant.request())),
                (variant, error) -> new ProbeResult(variant.removal(),
                        ProbeOutcome.failure("Probe aborted: " + error)),
                log);
    }

    public Request reduce(Request baseRequest, ResponseFingerprint baseline, List<ProbeResult> results) {
        return fold(baseRequest, acceptedRemovals(baseline, results));
    }

    public List<RemovalDescriptor> acceptedRemovals(ResponseFingerprint baseline, List<ProbeResult> results) {
        return results.stream()
                .filter(result -> matcher.matches(baseline, result.outcome()))
                .map(ProbeResult::removal)
                .collect(Collectors.toList());
    }

    public Minimization minimize(Request baseRequest, ResponseFingerprint baseline, ProbeTarget target) {
        List<RequestVariant> variants = enumerate(baseRequest);
        log.info("Probing {} single-removal variants against {}", variants.size(), target.authority());

        List<ProbeResult> results = probeAll(target, variants);
        List<RemovalDescriptor> accepted = acceptedRemovals(baseline, results);
        Minimization minimization = new Minimization(fold(baseRequest, accepted), results, accepted);

        log.info("Minimization finished: candidates={} accepted={} failedProbes={}",
                variants.size(), accepted.size(), minimization.failedProbes());
        return minimization;
    }

    // removals address distinct (key, location) pairs, so fold order does not matter
    private static Request fold(Request baseRequest, List<RemovalDescriptor> removals) {
        Request minimized = baseRequest.copy();
        removals.forEach(minimized::remove);
        return minimized;
    }

    public record Minimization(Request minimized, List<ProbeResult> results, List<RemovalDescriptor> accepted) {

        public long failedProbes() {
            return results.stream().filter(result -> !result.succeeded()).count();
        }
    }
}
