package io.github.sasproject.json.schema;

import java.util.logging.Level;
import java.util.logging.Logger;

/// One-line `event=NAME key=value ...` log records for the compile and validate milestones
final class StructuredLog {
  /// Longest value written before truncation
  static final int MAX_VALUE_LENGTH = 256;

  private StructuredLog() {}

  /// Log at FINE; pairs are key, value, key, value and a trailing odd key is dropped
  static void fine(Logger log, String event, Object... pairs) {
    if (log.isLoggable(Level.FINE)) {
      log.fine(() -> format(event, pairs));
    }
  }

  static String format(String event, Object... pairs) {
    StringBuilder line = new StringBuilder("event=").append(clean(event));
    for (int i = 1; i < pairs.length; i += 2) {
      if (pairs[i - 1] == null) {
        continue;
      }
      String value = clean(String.valueOf(pairs[i]));
      line.append(' ').append(pairs[i - 1]).append('=');
      boolean quote = value.chars().anyMatch(c -> c == '"' || Character.isWhitespace(c));
      line.append(quote ? '"' + value + '"' : value);
    }
    return line.toString();
  }

  private static String clean(String text) {
    String bounded = text.length() > MAX_VALUE_LENGTH ? text.substring(0, MAX_VALUE_LENGTH) + "..." : text;
    return bounded.replaceAll("[\\r\\n\\t]", " ");
  }
}
