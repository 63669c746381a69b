package com.example.striprequest.model;

/**
 * A probe outcome tagged with the removal that produced the probed variant.
 */
public record ProbeResult(RemovalDescriptor removal, ProbeOutcome outcome) {

    public boolean succeeded() {
        return outcome.succeeded();
    }
}
