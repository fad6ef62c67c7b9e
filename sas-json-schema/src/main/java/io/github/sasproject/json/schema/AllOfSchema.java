package io.github.sasproject.json.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Deque;
import java.util.List;

/// AllOf composition - must satisfy all schemas
///
/// The compiler also uses it to join the independent keyword groups of one schema object.
public record AllOfSchema(List<JsonSchema> schemas) implements JsonSchema {
  public AllOfSchema {
    schemas = List.copyOf(schemas);
  }

  @Override
  public ValidationResult validateAt(InstancePath path, JsonNode json, Deque<ValidationFrame> stack) {
    // Push all subschemas onto the stack for validation
    for (JsonSchema schema : schemas) {
      stack.push(new ValidationFrame(path, schema, json));
    }
    return ValidationResult.success(); // Actual results emerge from stack processing
  }
}
