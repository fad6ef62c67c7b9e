package io.github.sasproject.json.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Deque;
import java.util.List;

/// Enum schema - validates that a value is in a set of allowed values
public record EnumSchema(List<JsonNode> allowedValues) implements JsonSchema {
  public EnumSchema {
    allowedValues = List.copyOf(allowedValues);
  }

  @Override
  public ValidationResult validateAt(InstancePath path, JsonNode json, Deque<ValidationFrame> stack) {
    for (JsonNode allowed : allowedValues) {
      if (SchemaJson.jsonEquals(allowed, json)) {
        return ValidationResult.success();
      }
    }
    return ValidationResult.failure(List.of(new ValidationError(path, Keyword.ENUM, "Not in enum")));
  }
}
