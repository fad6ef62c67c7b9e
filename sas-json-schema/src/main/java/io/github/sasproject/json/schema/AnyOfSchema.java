package io.github.sasproject.json.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/// `anyOf`: passes when one branch passes; also carries `type` arrays such as `["string", "null"]`
public record AnyOfSchema(List<JsonSchema> schemas) implements JsonSchema {
  public AnyOfSchema {
    schemas = List.copyOf(schemas);
  }

  @Override
  public ValidationResult validateAt(InstancePath path, JsonNode json, Deque<ValidationFrame> stack) {
    List<ValidationError> failures = new ArrayList<>();
    for (JsonSchema branch : schemas) {
      List<ValidationError> branchErrors = Traversal.run(path, branch, json);
      if (branchErrors.isEmpty()) {
        return ValidationResult.success();
      }
      failures.addAll(branchErrors);
    }
    if (schemas.size() == 1) {
      return ValidationResult.failure(failures);
    }
    LOG.finer(() -> "anyOf failed at '" + path + "' after " + schemas.size() + " branches");
    String message = "No anyOf branch matched (" + schemas.size() + " tried): " + Traversal.summarize(failures);
    return ValidationResult.failure(List.of(new ValidationError(path, Keyword.ANY_OF, message)));
  }
}
