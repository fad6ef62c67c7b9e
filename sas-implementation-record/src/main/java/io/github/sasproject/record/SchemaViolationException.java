package io.github.sasproject.record;

import java.util.List;

/// Thrown when a record that must be valid is not; carries every violation found
public final class SchemaViolationException extends RuntimeException {
  private final List<SchemaViolation> violations;

  public SchemaViolationException(List<SchemaViolation> violations) {
    super(message(violations));
    this.violations = List.copyOf(violations);
  }

  public List<SchemaViolation> violations() {
    return violations;
  }

  private static String message(List<SchemaViolation> violations) {
    if (violations.isEmpty()) {
      return "Invalid SAS implementation record";
    }
    return "Invalid SAS implementation record: " + violations.size() + " violation(s), first "
        + violations.get(0).describe();
  }
}
