package com.example.striprequest.model;

/**
 * The four places a removable element can live inside a {@link Request}.
 */
public enum ElementLocation {
    QUERY_PARAMS,
    PARSED_BODY,
    HEADERS,
    COOKIES
}
