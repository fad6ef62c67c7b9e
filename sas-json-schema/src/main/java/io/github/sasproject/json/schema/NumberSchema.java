package io.github.sasproject.json.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/// Number schema with range and multiple constraints
///
/// Draft-04 `exclusiveMinimum`/`exclusiveMaximum` are booleans modifying `minimum`/`maximum`.
public record NumberSchema(
    BigDecimal minimum,
    BigDecimal maximum,
    BigDecimal multipleOf,
    boolean exclusiveMinimum,
    boolean exclusiveMaximum,
    boolean integer,
    boolean assertType
) implements JsonSchema {

  @Override
  public ValidationResult validateAt(InstancePath path, JsonNode json, Deque<ValidationFrame> stack) {
    LOG.finest(() -> "NumberSchema.validateAt: " + json + " minimum=" + minimum + " maximum=" + maximum);
    if (!json.isNumber()) {
      return assertType
          ? ValidationResult.failure(List.of(new ValidationError(path, Keyword.TYPE, integer ? "Expected integer" : "Expected number")))
          : ValidationResult.success();
    }

    BigDecimal value = json.decimalValue();
    if (integer && !isIntegral(value)) {
      return ValidationResult.failure(List.of(new ValidationError(path, Keyword.TYPE, "Expected integer")));
    }
    List<ValidationError> errors = new ArrayList<>();

    if (minimum != null) {
      int comparison = value.compareTo(minimum);
      if (exclusiveMinimum ? comparison <= 0 : comparison < 0) {
        errors.add(new ValidationError(path, Keyword.MINIMUM, "Below minimum " + minimum));
      }
    }

    if (maximum != null) {
      int comparison = value.compareTo(maximum);
      if (exclusiveMaximum ? comparison >= 0 : comparison > 0) {
        errors.add(new ValidationError(path, Keyword.MAXIMUM, "Above maximum " + maximum));
      }
    }

    if (multipleOf != null) {
      BigDecimal remainder = value.remainder(multipleOf);
      if (remainder.compareTo(BigDecimal.ZERO) != 0) {
        errors.add(new ValidationError(path, Keyword.MULTIPLE_OF, "Not multiple of " + multipleOf));
      }
    }

    return errors.isEmpty() ? ValidationResult.success() : ValidationResult.failure(errors);
  }

  private static boolean isIntegral(BigDecimal value) {
    return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
  }
}
