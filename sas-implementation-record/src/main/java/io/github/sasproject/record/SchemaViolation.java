package io.github.sasproject.record;

import io.github.sasproject.json.schema.Keyword;

import java.util.Objects;

/// A single reason a candidate record was rejected
///
/// @param field top-level member the violation belongs to, empty when the candidate itself is at fault
/// @param path full instance path, e.g. `contactInformation[0].vcard.fn`
/// @param type violation kind
/// @param keyword schema keyword that failed
/// @param message validator message
public record SchemaViolation(String field, String path, ViolationType type, Keyword keyword, String message) {
  public SchemaViolation {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(keyword, "keyword");
    Objects.requireNonNull(message, "message");
  }

  /// One-line form used by logs and the command line checker
  public String describe() {
    return type + " at " + (path.isEmpty() ? "<record>" : path) + ": " + message;
  }
}
