package io.github.sasproject.record;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/// Outcome of validating one candidate record; `violations` is ordered by record field then path
public record RecordValidationReport(boolean valid, List<SchemaViolation> violations) {
  public RecordValidationReport {
    violations = List.copyOf(violations);
    if (valid != violations.isEmpty()) {
      throw new IllegalArgumentException("valid must be true exactly when there are no violations");
    }
  }

  static RecordValidationReport of(List<SchemaViolation> violations) {
    return new RecordValidationReport(violations.isEmpty(), violations);
  }

  public Optional<SchemaViolation> firstViolation() {
    return violations.stream().findFirst();
  }

  public List<SchemaViolation> violationsOf(ViolationType type) {
    return violations.stream().filter(v -> v.type() == type).collect(Collectors.toList());
  }
}
