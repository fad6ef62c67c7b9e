package io.github.sasproject.json.schema;

import java.util.Locale;

/// Format validator interface for string format validation
sealed public interface FormatValidator permits Format {
  /// Test if the string value matches the format
  /// @param s the string to test
  /// @return true if the string matches the format, false otherwise
  boolean test(String s);

  /// Name as written in a schema's `format` keyword
  default String formatName() {
    return this instanceof Format ? ((Format) this).name().toLowerCase(Locale.ROOT).replace('_', '-') : "unknown";
  }
}
