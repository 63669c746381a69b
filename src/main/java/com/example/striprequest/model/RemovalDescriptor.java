package com.example.striprequest.model;

import java.util.Objects;

/**
 * Identifies the single element stripped from a base request to produce a variant.
 */
public record RemovalDescriptor(String key, ElementLocation location) {

    public RemovalDescriptor {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(location, "location");
    }

    @Override
    public String toString() {
        return location + ":" + key;
    }
}
