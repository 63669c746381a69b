package com.example.striprequest.clients.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

public class JsonUtil {

  private static final ObjectMapper MAPPER;
  private static final ObjectWriter COMPACT_WRITER;

  static {
    MAPPER =
        JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS.mappedFeature())
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA.mappedFeature())
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES.mappedFeature())
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .nodeFactory(JsonNodeFactory.withExactBigDecimals(true))
            .disable(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    MAPPER.registerModule(new JavaTimeModule());
    COMPACT_WRITER = MAPPER.writer().without(SerializationFeature.INDENT_OUTPUT);
  }

  private JsonUtil() {
    // Prevent instantiation
  }

  /**
   * Parses a complete JSON document; trailing content after the first value is an error. Floating-point
   * numbers are kept as exact decimals so they are written back digit for digit.
   */
  public static JsonNode readTree(String json) throws JsonProcessingException {
    return MAPPER.readTree(json);
  }

  /** Converts an object to a JSON string (pretty printed). */
  public static String toJson(Object obj) throws JsonProcessingException {
    return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(obj);
  }

  /** Single-line JSON, as sent on the wire. */
  public static String toCompactJson(JsonNode node) throws JsonProcessingException {
    return COMPACT_WRITER.writeValueAsString(node);
  }
}
