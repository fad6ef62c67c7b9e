package io.github.sasproject.json.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Deque;
import java.util.List;

/// `not`: passes when the inner schema fails; `false` schemas compile to `not {}`
public record NotSchema(JsonSchema schema) implements JsonSchema {
  @Override
  public ValidationResult validateAt(InstancePath path, JsonNode json, Deque<ValidationFrame> stack) {
    if (!Traversal.run(path, schema, json).isEmpty()) {
      return ValidationResult.success();
    }
    return ValidationResult.failure(List.of(new ValidationError(path, Keyword.NOT, "Schema should not match")));
  }
}
