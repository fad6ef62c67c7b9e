package io.github.sasproject.record;

import java.util.logging.Logger;

/// Centralized logger for the SAS record layer
final class RecordLogging {
  static final Logger LOG = Logger.getLogger("io.github.sasproject.record");

  private RecordLogging() {}
}
