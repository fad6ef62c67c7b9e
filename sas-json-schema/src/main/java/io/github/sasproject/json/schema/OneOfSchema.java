package io.github.sasproject.json.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Deque;
import java.util.List;

/// `oneOf`: exactly one branch may pass
public record OneOfSchema(List<JsonSchema> schemas) implements JsonSchema {
  public OneOfSchema {
    schemas = List.copyOf(schemas);
  }

  @Override
  public ValidationResult validateAt(InstancePath path, JsonNode json, Deque<ValidationFrame> stack) {
    int passed = 0;
    List<ValidationError> closest = null;
    for (JsonSchema branch : schemas) {
      List<ValidationError> branchErrors = Traversal.run(path, branch, json);
      if (branchErrors.isEmpty()) {
        passed++;
      } else if (closest == null || branchErrors.size() < closest.size()) {
        closest = branchErrors;
      }
    }
    if (passed == 1) {
      return ValidationResult.success();
    }
    String message = passed == 0
        ? "oneOf: no schema matched" + (closest == null ? "" : ": " + Traversal.summarize(closest))
        : "oneOf: multiple schemas matched (" + passed + ")";
    return ValidationResult.failure(List.of(new ValidationError(path, Keyword.ONE_OF, message)));
  }
}
