package io.github.sasproject.record;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.sasproject.json.schema.SchemaJson;

import java.util.Objects;

/// JSON binding for [SasImplementationRecord]; reads always validate before binding
public final class SasRecordCodec {
  private static final ObjectMapper MAPPER = SchemaJson.mapper().copy();

  private final SasRecordValidator validator;

  public SasRecordCodec(SasRecordValidator validator) {
    this.validator = Objects.requireNonNull(validator, "validator");
  }

  public static SasRecordCodec bundled() {
    return new SasRecordCodec(SasRecordValidator.bundled());
  }

  /// Serialize without validating; absent optional members are omitted
  public String toJson(SasImplementationRecord record) {
    Objects.requireNonNull(record, "record");
    try {
      return MAPPER.writeValueAsString(record);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to serialize record " + record.id(), e);
    }
  }

  public JsonNode toTree(SasImplementationRecord record) {
    Objects.requireNonNull(record, "record");
    return tree(record);
  }

  /// Parse, validate and bind JSON text
  /// @throws IllegalArgumentException if the text is not JSON
  /// @throws SchemaViolationException if the record does not conform
  public SasImplementationRecord read(String json) {
    Objects.requireNonNull(json, "json");
    return read(SchemaJson.parse(json));
  }

  /// Validate and bind a parsed candidate
  /// @throws SchemaViolationException if the record does not conform
  public SasImplementationRecord read(JsonNode candidate) {
    Objects.requireNonNull(candidate, "candidate");
    validator.requireValid(candidate);
    try {
      return MAPPER.treeToValue(candidate, SasImplementationRecord.class);
    } catch (JsonProcessingException e) {
      // A schema-valid tree that fails to bind means the model and the schema disagree
      throw new IllegalStateException("Valid record did not bind: " + e.getOriginalMessage(), e);
    }
  }

  static JsonNode tree(SasImplementationRecord record) {
    return MAPPER.valueToTree(record);
  }
}
