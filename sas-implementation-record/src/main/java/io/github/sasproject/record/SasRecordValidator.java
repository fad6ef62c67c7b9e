package io.github.sasproject.record;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.sasproject.json.schema.InstancePath;
import io.github.sasproject.json.schema.JsonSchema;
import io.github.sasproject.json.schema.Keyword;
import io.github.sasproject.json.schema.SchemaJson;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static io.github.sasproject.record.RecordLogging.LOG;

/// Validates candidate SAS implementation records and classifies each failure
///
/// Stateless apart from the shared [SasRecordSchema]; one instance serves any number of threads.
public final class SasRecordValidator {
  /// Members whose values are checked by an external sub-schema
  static final Set<String> NESTED_FIELDS = Set.of("contactInformation", "fccInformation");

  private static final Comparator<SchemaViolation> REPORT_ORDER =
      Comparator.comparingInt((SchemaViolation v) -> fieldRank(v.field()))
          .thenComparing(SchemaViolation::path)
          .thenComparing(v -> v.type().ordinal());

  private final SasRecordSchema schema;

  public SasRecordValidator(SasRecordSchema schema) {
    this.schema = Objects.requireNonNull(schema, "schema");
  }

  /// Validator over the bundled schema documents
  public static SasRecordValidator bundled() {
    return new SasRecordValidator(SasRecordSchema.bundled());
  }

  public SasRecordSchema schema() {
    return schema;
  }

  /// Validate a parsed candidate; any JSON value is accepted, non-objects fail with a type mismatch
  public RecordValidationReport validate(JsonNode candidate) {
    Objects.requireNonNull(candidate, "candidate");
    JsonSchema.ValidationResult result = schema.schema().validate(candidate);
    if (result.valid()) {
      LOG.fine(() -> "record valid id=" + textOrNull(candidate, "id"));
      return RecordValidationReport.of(List.of());
    }
    List<SchemaViolation> violations = new ArrayList<>(result.errors().size());
    for (JsonSchema.ValidationError error : result.errors()) {
      violations.add(classify(error));
    }
    violations.sort(REPORT_ORDER);
    LOG.fine(() -> "record invalid id=" + textOrNull(candidate, "id") + " violations=" + violations.size());
    return RecordValidationReport.of(violations);
  }

  /// Parse then validate JSON text
  /// @throws IllegalArgumentException if the text is not JSON
  public RecordValidationReport validate(String json) {
    Objects.requireNonNull(json, "json");
    return validate(SchemaJson.parse(json));
  }

  /// Validate the wire form of an in-memory record
  public RecordValidationReport validate(SasImplementationRecord record) {
    Objects.requireNonNull(record, "record");
    return validate(SasRecordCodec.tree(record));
  }

  /// @throws SchemaViolationException carrying every violation when the candidate is invalid
  public void requireValid(JsonNode candidate) {
    RecordValidationReport report = validate(candidate);
    if (!report.valid()) {
      throw new SchemaViolationException(report.violations());
    }
  }

  public void requireValid(SasImplementationRecord record) {
    Objects.requireNonNull(record, "record");
    requireValid(SasRecordCodec.tree(record));
  }

  /// Map an engine error onto the record taxonomy using its instance location and keyword
  ///
  /// `required` and `additionalProperties` failures one step below the root come from the
  /// record object itself, so they name a top-level member even when that member is one of
  /// the [#NESTED_FIELDS].
  static SchemaViolation classify(JsonSchema.ValidationError error) {
    InstancePath location = error.location();
    String field = location.rootMember().orElse("");
    boolean topLevel = location.depth() == 1;
    ViolationType type;
    if (topLevel && error.keyword() == Keyword.REQUIRED) {
      type = ViolationType.MISSING_REQUIRED_FIELD;
    } else if (topLevel && error.keyword() == Keyword.ADDITIONAL_PROPERTIES) {
      type = ViolationType.UNEXPECTED_FIELD;
    } else if (NESTED_FIELDS.contains(field) && (!topLevel || error.keyword() != Keyword.TYPE)) {
      type = ViolationType.NESTED_SCHEMA_VIOLATION;
    } else {
      switch (error.keyword()) {
        case REQUIRED:
          type = ViolationType.MISSING_REQUIRED_FIELD;
          break;
        case ADDITIONAL_PROPERTIES:
          type = ViolationType.UNEXPECTED_FIELD;
          break;
        case TYPE:
          type = ViolationType.TYPE_MISMATCH;
          break;
        case PATTERN:
          type = ViolationType.PATTERN_VIOLATION;
          break;
        case FORMAT:
          type = ViolationType.FORMAT_VIOLATION;
          break;
        default:
          type = ViolationType.CONSTRAINT_VIOLATION;
          break;
      }
    }
    return new SchemaViolation(field, error.path(), type, error.keyword(), error.message());
  }

  private static int fieldRank(String field) {
    int index = SasImplementationRecord.FIELDS.indexOf(field);
    if (field.isEmpty()) {
      return -1;
    }
    return index >= 0 ? index : SasImplementationRecord.FIELDS.size();
  }

  private static String textOrNull(JsonNode candidate, String member) {
    JsonNode value = candidate.get(member);
    return value != null && value.isTextual() ? value.textValue() : null;
  }
}
