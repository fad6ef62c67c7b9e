package io.github.sasproject.json.schema;

import java.util.logging.Logger;

/// Centralized logger for the JSON Schema subsystem.
/// All classes must use this logger via:
///   import static io.github.sasproject.json.schema.SchemaLogging.LOG;
final class SchemaLogging {
  public static final Logger LOG = Logger.getLogger("io.github.sasproject.json.schema");
  private SchemaLogging() {}
}
