package com.example.striprequest.model;

import java.util.Objects;

/**
 * Where probes are sent.
 */
public record ProbeTarget(String host, int port, boolean tls) {

    public ProbeTarget {
        Objects.requireNonNull(host, "host");
        if (port < 1 || port > 0xFFFF) {
            throw new IllegalArgumentException("Port number must be between 1 and 65535, got " + port);
        }
    }

    public String authority() {
        return host + ":" + port;
    }
}
