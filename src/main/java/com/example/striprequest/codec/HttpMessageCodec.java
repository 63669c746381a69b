package com.example.striprequest.codec;

import com.example.striprequest.clients.utils.JsonUtil;
import com.example.striprequest.model.BodyType;
import com.example.striprequest.model.ProbeOutcome;
import com.example.striprequest.model.Request;
import com.example.striprequest.model.ResponseFingerprint;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts between raw request text and {@link Request}, and turns a response header block into a
 * {@link ResponseFingerprint}.
 * <p>
 * The conversion is deliberately lossy: header order follows insertion, duplicate keys collapse to the
 * last value, and delimiter characters inside values are dropped (see {@link DelimitedFields}).
 * {@code serialize(parse(x))} is therefore not {@code x}, but {@code parse(serialize(parse(x)))} equals
 * {@code parse(x)}.
 */
@Component
public class HttpMessageCodec {

    private static final Logger log = LoggerFactory.getLogger(HttpMessageCodec.class);

    static final String COOKIE_HEADER = "Cookie";
    static final String CONTENT_LENGTH_HEADER = "Content-Length";

    private static final String LF = "\n";
    private static final String BLANK_LINE = "\n\n";

    public Request parse(String rawText) {
        Objects.requireNonNull(rawText, "Raw request cannot be null");
        String text = normalizeLineEndings(rawText);
        List<String> lines = trimmedLines(text);

        Request request = new Request();
        parseRequestLine(lines.get(0), request);

        Map<String, String> headers = parseHeaderBlock(lines);
        String cookieHeader = headers.remove(COOKIE_HEADER);
        headers.keySet().removeIf(CONTENT_LENGTH_HEADER::equalsIgnoreCase);
        request.setHeaders(headers);
        request.setCookies(DelimitedFields.parseCookiePairs(cookieHeader));

        parseBody(text, request);
        return request;
    }

    public String serialize(Request request) {
        Objects.requireNonNull(request, "Request cannot be null");
        List<String> head = new ArrayList<>();
        head.add(String.join(" ",
                request.getMethod().toUpperCase(Locale.ROOT),
                pathWithQuery(request),
                request.getVersion()));

        request.getHeaders().forEach((name, value) -> head.add(name + ": " + value));

        if (!request.getCookies().isEmpty()) {
            head.add(COOKIE_HEADER + ": " + joinPairs(request.getCookies(), "; "));
        }

        String body = encodeBody(request);
        if (body.isEmpty()) {
            return String.join(LF, head) + BLANK_LINE;
        }
        head.add(CONTENT_LENGTH_HEADER + ": " + body.getBytes(StandardCharsets.UTF_8).length);
        return String.join(LF, head) + BLANK_LINE + body + BLANK_LINE;
    }

    /**
     * Parses a response header block as read by the transport. The status line must look like
     * {@code VERSION CODE MESSAGE...}; a non-numeric code usually means plaintext was spoken to a TLS port
     * or the other way round.
     */
    public ProbeOutcome parseResponse(String rawHeaderBlock) {
        if (rawHeaderBlock == null || rawHeaderBlock.isBlank()) {
            return ProbeOutcome.failure("Empty response from server");
        }
        List<String> lines = trimmedLines(normalizeLineEndings(rawHeaderBlock));
        String[] status = lines.get(0).split(" ");

        int statusCode;
        try {
            statusCode = Integer.parseInt(status.length > 1 ? status[1] : "");
        } catch (NumberFormatException e) {
            log.debug("Unparseable status line: {}", lines.get(0));
            return ProbeOutcome.failure(
                    "Did not receive a valid status line; the chosen protocol (HTTP vs TLS) may be wrong");
        }

        String statusMessage = Arrays.stream(status).skip(2).collect(Collectors.joining(" "));
        Map<String, String> headers = parseHeaderBlock(lines);
        return ProbeOutcome.success(
                new ResponseFingerprint(headers, contentLength(headers), statusCode, statusMessage));
    }

    private void parseRequestLine(String requestLine, Request request) {
        String[] tokens = requestLine.split(" ");
        request.setMethod(token(tokens, 0).toUpperCase(Locale.ROOT));
        request.setVersion(token(tokens, 2));

        String target = token(tokens, 1);
        int question = target.indexOf('?');
        if (question < 0) {
            request.setPath(target);
            request.setQueryParams(new LinkedHashMap<>());
        } else {
            request.setPath(target.substring(0, question));
            request.setQueryParams(DelimitedFields.parseAmpersandPairs(target.substring(question + 1)));
        }
    }

    private Map<String, String> parseHeaderBlock(List<String> lines) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String line : lines.subList(1, lines.size())) {
            if (line.isEmpty()) {
                break;
            }
            Map.Entry<String, String> header = DelimitedFields.parseHeaderLine(line);
            headers.put(header.getKey(), header.getValue());
        }
        return headers;
    }

    private void parseBody(String text, Request request) {
        List<String> segments = Arrays.stream(text.split(BLANK_LINE))
                .map(String::trim)
                .filter(segment -> !segment.isEmpty())
                .collect(Collectors.toList());
        if (segments.size() <= 1) {
            request.setBodyType(BodyType.EMPTY);
            return;
        }

        String body = segments.get(segments.size() - 1);
        try {
            request.setJsonBody(JsonUtil.readTree(body));
            request.setBodyType(BodyType.JSON);
        } catch (JsonProcessingException e) {
            Map<String, String> form = DelimitedFields.parseAmpersandPairs(body);
            if (form.isEmpty()) {
                request.setBodyType(BodyType.EMPTY);
            } else {
                request.setFormBody(form);
                request.setBodyType(BodyType.FORM);
            }
        }
    }

    private String encodeBody(Request request) {
        return switch (request.getBodyType()) {
            case EMPTY -> "";
            case FORM -> joinPairs(request.getFormBody(), "&");
            case JSON -> encodeJson(request.getJsonBody());
        };
    }

    private String encodeJson(JsonNode body) {
        if (body == null) {
            return "";
        }
        try {
            return JsonUtil.toCompactJson(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JSON body: " + e.getMessage(), e);
        }
    }

    private String pathWithQuery(Request request) {
        if (request.getQueryParams().isEmpty()) {
            return request.getPath();
        }
        return request.getPath() + "?" + joinPairs(request.getQueryParams(), "&");
    }

    private static String joinPairs(Map<String, String> pairs, String separator) {
        return pairs.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(separator));
    }

    private static int contentLength(Map<String, String> headers) {
        String value = headers.get(CONTENT_LENGTH_HEADER);
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static List<String> trimmedLines(String text) {
        return Arrays.stream(text.split(LF, -1))
                .map(String::trim)
                .collect(Collectors.toList());
    }

    private static String token(String[] tokens, int index) {
        return index < tokens.length ? tokens[index].trim() : "";
    }

    private static String normalizeLineEndings(String text) {
        return text.replace("\r\n", LF);
    }
}
