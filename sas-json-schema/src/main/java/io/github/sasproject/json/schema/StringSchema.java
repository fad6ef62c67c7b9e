package io.github.sasproject.json.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

/// String schema with length, pattern, and format constraints
public record StringSchema(
    Integer minLength,
    Integer maxLength,
    Pattern pattern,
    FormatValidator formatValidator,
    boolean assertFormats,
    boolean assertType
) implements JsonSchema {

  @Override
  public ValidationResult validateAt(InstancePath path, JsonNode json, Deque<ValidationFrame> stack) {
    if (!json.isTextual()) {
      return assertType
          ? ValidationResult.failure(List.of(new ValidationError(path, Keyword.TYPE, "Expected string")))
          : ValidationResult.success();
    }

    String value = json.textValue();
    List<ValidationError> errors = new ArrayList<>();

    // Lengths count code points, not UTF-16 units
    int length = value.codePointCount(0, value.length());
    if (minLength != null && length < minLength) {
      errors.add(new ValidationError(path, Keyword.MIN_LENGTH, "String too short: expected at least " + minLength + " characters"));
    }
    if (maxLength != null && length > maxLength) {
      errors.add(new ValidationError(path, Keyword.MAX_LENGTH, "String too long: expected at most " + maxLength + " characters"));
    }

    // Check pattern (unanchored matching - uses find() instead of matches())
    if (pattern != null && !pattern.matcher(value).find()) {
      errors.add(new ValidationError(path, Keyword.PATTERN, "Pattern mismatch: " + pattern.pattern()));
    }

    // Check format validation (only when format assertion is enabled)
    if (formatValidator != null && assertFormats && !formatValidator.test(value)) {
      errors.add(new ValidationError(path, Keyword.FORMAT, "Invalid format '" + formatValidator.formatName() + "'"));
    }

    return errors.isEmpty() ? ValidationResult.success() : ValidationResult.failure(errors);
  }
}
