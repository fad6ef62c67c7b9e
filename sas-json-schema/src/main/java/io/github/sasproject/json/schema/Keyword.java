package io.github.sasproject.json.schema;

/// Schema keyword whose assertion produced a [JsonSchema.ValidationError]
public enum Keyword {
  TYPE("type"),
  REQUIRED("required"),
  ADDITIONAL_PROPERTIES("additionalProperties"),
  MIN_PROPERTIES("minProperties"),
  MAX_PROPERTIES("maxProperties"),
  ADDITIONAL_ITEMS("additionalItems"),
  MIN_ITEMS("minItems"),
  MAX_ITEMS("maxItems"),
  UNIQUE_ITEMS("uniqueItems"),
  MIN_LENGTH("minLength"),
  MAX_LENGTH("maxLength"),
  PATTERN("pattern"),
  FORMAT("format"),
  MINIMUM("minimum"),
  MAXIMUM("maximum"),
  MULTIPLE_OF("multipleOf"),
  ENUM("enum"),
  ANY_OF("anyOf"),
  ONE_OF("oneOf"),
  NOT("not");

  private final String jsonName;

  Keyword(String jsonName) {
    this.jsonName = jsonName;
  }

  /// Keyword as spelled in a schema document
  public String jsonName() {
    return jsonName;
  }
}
