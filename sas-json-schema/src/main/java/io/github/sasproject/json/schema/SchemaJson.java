package io.github.sasproject.json.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.util.Comparator;
import java.util.Objects;

/// Jackson plumbing shared by the compiler, the fetchers and callers that hold raw JSON text.
///
/// Floats are read as `BigDecimal` so numeric keywords compare exactly.
public final class SchemaJson {
  private static final ObjectMapper MAPPER = JsonMapper.builder()
      .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
      .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
      .build();

  /// Structural equality where numbers compare by value (`1` equals `1.0`)
  private static final Comparator<JsonNode> NUMERIC_AWARE = (a, b) -> {
    if (a.equals(b)) {
      return 0;
    }
    if (a.isNumber() && b.isNumber()) {
      return a.decimalValue().compareTo(b.decimalValue());
    }
    return 1;
  };

  private SchemaJson() {}

  /// Parse JSON text into a tree
  /// @throws IllegalArgumentException if the text is not a single JSON value
  public static JsonNode parse(String json) {
    Objects.requireNonNull(json, "json");
    try {
      return requirePresent(MAPPER.readTree(json));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
    }
  }

  /// Parse UTF-8 JSON bytes into a tree
  /// @throws IllegalArgumentException if the bytes are not a single JSON value
  public static JsonNode parse(byte[] json) {
    Objects.requireNonNull(json, "json");
    try {
      return requirePresent(MAPPER.readTree(json));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new IllegalArgumentException("Unreadable JSON: " + e.getMessage(), e);
    }
  }

  /// The mapper used for parsing, for callers that bind trees to Java types
  public static ObjectMapper mapper() {
    return MAPPER;
  }

  static boolean jsonEquals(JsonNode a, JsonNode b) {
    return a.equals(NUMERIC_AWARE, b);
  }

  private static JsonNode requirePresent(JsonNode node) {
    if (node == null || node.isMissingNode()) {
      throw new IllegalArgumentException("Invalid JSON: empty document");
    }
    return node;
  }
}
