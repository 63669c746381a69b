package com.example.striprequest.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;

/**
 * Structured, mutable view of a captured HTTP request. Each probe works on its own {@link #copy()}.
 * <p>
 * The removable elements live in four insertion-ordered maps: query parameters, headers, cookies and,
 * for {@link BodyType#FORM} bodies, the form fields. A {@code Cookie} header is never stored in
 * {@link #headers}; its pairs live in {@link #cookies}.
 */
@Data
public class Request {

    private String method = "";
    private String path = "";
    private Map<String, String> queryParams = new LinkedHashMap<>();
    private String version = "";
    private Map<String, String> headers = new LinkedHashMap<>();
    private Map<String, String> cookies = new LinkedHashMap<>();
    private BodyType bodyType = BodyType.EMPTY;
    private JsonNode jsonBody;
    private Map<String, String> formBody = new LinkedHashMap<>();

    /** Value of the {@code Host} header, or {@code null} when the capture has none. */
    public String getHost() {
        return headers.get("Host");
    }

    /**
     * Live view of the elements stored at {@code location}. Body fields are only exposed for form bodies;
     * JSON and empty bodies yield an empty, unmodifiable map.
     */
    public Map<String, String> elements(ElementLocation location) {
        return switch (location) {
            case QUERY_PARAMS -> queryParams;
            case HEADERS -> headers;
            case COOKIES -> cookies;
            case PARSED_BODY -> bodyType == BodyType.FORM ? formBody : Collections.emptyMap();
        };
    }

    public void remove(RemovalDescriptor removal) {
        Map<String, String> target = elements(removal.location());
        if (!target.isEmpty()) {
            target.remove(removal.key());
        }
    }

    public Request without(RemovalDescriptor removal) {
        Request variant = copy();
        variant.remove(removal);
        return variant;
    }

    public Request copy() {
        Request copy = new Request();
        copy.method = method;
        copy.path = path;
        copy.queryParams = new LinkedHashMap<>(queryParams);
        copy.version = version;
        copy.headers = new LinkedHashMap<>(headers);
        copy.cookies = new LinkedHashMap<>(cookies);
        copy.bodyType = bodyType;
        copy.jsonBody = jsonBody != null ? jsonBody.deepCopy() : null;
        copy.formBody = new LinkedHashMap<>(formBody);
        return copy;
    }
}
