package com.example.striprequest.model;

/**
 * A copy of the base request with exactly one element removed.
 */
public record RequestVariant(RemovalDescriptor removal, Request request) {
}
