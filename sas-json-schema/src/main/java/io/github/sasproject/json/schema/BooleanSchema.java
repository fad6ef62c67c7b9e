package io.github.sasproject.json.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Deque;
import java.util.List;

/// Boolean schema - validates boolean values
public record BooleanSchema() implements JsonSchema {
  @Override
  public ValidationResult validateAt(InstancePath path, JsonNode json, Deque<ValidationFrame> stack) {
    if (!json.isBoolean()) {
      return ValidationResult.failure(List.of(
          new ValidationError(path, Keyword.TYPE, "Expected boolean")
      ));
    }
    return ValidationResult.success();
  }
}
