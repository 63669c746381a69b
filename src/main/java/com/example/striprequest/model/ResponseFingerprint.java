package com.example.striprequest.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The parts of a response header block used to decide whether two responses are equivalent. Headers are
 * kept for reporting only, in the order the server sent them.
 */
public record ResponseFingerprint(Map<String, String> headers,
                                  int contentLength,
                                  int statusCode,
                                  String statusMessage) {

    public ResponseFingerprint {
        headers = headers != null ? Collections.unmodifiableMap(new LinkedHashMap<>(headers)) : Map.of();
        statusMessage = statusMessage != null ? statusMessage : "";
    }
}
