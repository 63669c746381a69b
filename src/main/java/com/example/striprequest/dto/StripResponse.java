package com.example.striprequest.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Data;

@Data
public class StripResponse {
    private String host;
    private int port;
    private boolean tls;
    private String originalRequest;
    private String requestedHost;
    private Fingerprint baseline;
    private String strippedRequest;
    private Fingerprint strippedResponse;
    private String strippedResponseError;
    private List<RemovedElement> removed;
    private int candidates;
    private long failedProbes;
    private Instant startedAt;
    private long elapsedMs;

    @Data
    public static class Fingerprint {
        private int statusCode;
        private String statusMessage;
        private int contentLength;
        private Map<String, String> headers;
    }

    @Data
    public static class RemovedElement {
        private String key;
        private String location;
    }
}
