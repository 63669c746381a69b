package com.example.striprequest.codec;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Split rules shared by every element category of the codec.
 * <p>
 * A field is split on its delimiter; the first part is the key and the remaining parts are concatenated
 * <em>without</em> the delimiter to form the value, so {@code a=b=c} becomes {@code a -> bc}. The dropped
 * delimiters are not restored on serialization.
 */
final class DelimitedFields {

    private static final Pattern AMPERSAND = Pattern.compile("&");
    private static final Pattern SEMICOLON = Pattern.compile(";");
    private static final Pattern EQUALS = Pattern.compile("=");
    private static final Pattern COLON = Pattern.compile(":");

    private DelimitedFields() {
    }

    /** {@code k=v&k=v}, used for query strings and form bodies. Later duplicates overwrite earlier values. */
    static Map<String, String> parseAmpersandPairs(String text) {
        return parsePairs(text, AMPERSAND);
    }

    /** {@code k=v; k=v}, the value of a {@code Cookie} header. */
    static Map<String, String> parseCookiePairs(String text) {
        return parsePairs(text, SEMICOLON);
    }

    /** {@code Name: value}, a single header line. */
    static Map.Entry<String, String> parseHeaderLine(String line) {
        return fold(line, COLON);
    }

    static Map.Entry<String, String> parseKeyValue(String segment) {
        return fold(segment, EQUALS);
    }

    private static Map<String, String> parsePairs(String text, Pattern separator) {
        Map<String, String> pairs = new LinkedHashMap<>();
        if (text == null || text.isEmpty()) {
            return pairs;
        }
        for (String segment : separator.split(text)) {
            String trimmed = segment.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            Map.Entry<String, String> pair = parseKeyValue(trimmed);
            pairs.put(pair.getKey(), pair.getValue());
        }
        return pairs;
    }

    private static Map.Entry<String, String> fold(String text, Pattern delimiter) {
        String[] parts = delimiter.split(text);
        if (parts.length == 0) {
            return new SimpleImmutableEntry<>("", "");
        }
        StringBuilder value = new StringBuilder();
        for (int i = 1; i < parts.length; i++) {
            value.append(parts[i]);
        }
        return new SimpleImmutableEntry<>(parts[0].trim(), value.toString().trim());
    }
}
