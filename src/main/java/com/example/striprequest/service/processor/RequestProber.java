package com.example.striprequest.service.processor;

import com.example.striprequest.clients.Transport;
import com.example.striprequest.clients.TransportException;
import com.example.striprequest.codec.HttpMessageCodec;
import com.example.striprequest.model.ProbeOutcome;
import com.example.striprequest.model.ProbeTarget;
import com.example.striprequest.model.Request;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sends a single request through the {@link Transport} and fingerprints the reply. Failures come back as
 * {@link ProbeOutcome#failure(String)}, never as exceptions.
 */
@Component
public class RequestProber {

    private static final Logger log = LoggerFactory.getLogger(RequestProber.class);

    private final Transport transport;
    private final HttpMessageCodec codec;

    public RequestProber(Transport transport, HttpMessageCodec codec) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public ProbeOutcome probe(ProbeTarget target, Request request) {
        return probeRaw(target, codec.serialize(request));
    }

    public ProbeOutcome probeRaw(ProbeTarget target, String rawRequest) {
        long startTime = System.nanoTime();
        try {
            String headerBlock = transport.exchange(target, rawRequest);
            ProbeOutcome outcome = codec.parseResponse(headerBlock);
            log.debug("Probe to {} finished in {} ms: {}", target.authority(),
                    (System.nanoTime() - startTime) / 1_000_000,
                    outcome.succeeded() ? outcome.fingerprint().statusCode() : outcome.error());
            return outcome;
        } catch (TransportException e) {
            log.debug("Probe to {} failed: {}", target.authority(), e.getMessage());
            return ProbeOutcome.failure(e.getMessage());
        }
    }
}
