package com.example.striprequest.model;

/**
 * Closed set of body encodings the codec understands. {@link #FORM} is the only one whose fields are
 * removal candidates.
 */
public enum BodyType {
    EMPTY,
    JSON,
    FORM
}
