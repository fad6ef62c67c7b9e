package io.github.sasproject.record;

/// Kinds of schema violation reported for a candidate record
public enum ViolationType {
  /// One of the seven record members is absent
  MISSING_REQUIRED_FIELD,
  /// A top-level member not declared by the record schema
  UNEXPECTED_FIELD,
  /// A top-level value of the wrong JSON type, or a candidate that is not an object
  TYPE_MISMATCH,
  /// `id` does not contain three slash-separated segments
  PATTERN_VIOLATION,
  /// `url` is not an absolute URI
  FORMAT_VIOLATION,
  /// A failure inside a `contactInformation` element or inside `fccInformation`
  NESTED_SCHEMA_VIOLATION,
  /// Any other keyword, only reachable with an injected record schema
  CONSTRAINT_VIOLATION
}
