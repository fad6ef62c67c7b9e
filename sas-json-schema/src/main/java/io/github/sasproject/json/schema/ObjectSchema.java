package io.github.sasproject.json.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.*;
import java.util.regex.Pattern;

/// Object schema with properties, required fields, and constraints
///
/// `additionalProperties` is null when unmatched members are checked by nothing;
/// `additionalPropertiesAllowed` is false for `"additionalProperties": false`.
public record ObjectSchema(
    Map<String, JsonSchema> properties,
    Set<String> required,
    JsonSchema additionalProperties,
    boolean additionalPropertiesAllowed,
    Integer minProperties,
    Integer maxProperties,
    Map<Pattern, JsonSchema> patternProperties,
    boolean assertType
) implements JsonSchema {

  public ObjectSchema {
    properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    required = Collections.unmodifiableSet(new LinkedHashSet<>(required));
    patternProperties = Collections.unmodifiableMap(new LinkedHashMap<>(patternProperties));
  }

  @Override
  public ValidationResult validateAt(InstancePath path, JsonNode json, Deque<ValidationFrame> stack) {
    if (!(json instanceof ObjectNode)) {
      return assertType
          ? ValidationResult.failure(List.of(new ValidationError(path, Keyword.TYPE, "Expected object")))
          : ValidationResult.success();
    }
    ObjectNode obj = (ObjectNode) json;

    List<ValidationError> errors = new ArrayList<>();

    // Check property count constraints
    int propCount = obj.size();
    if (minProperties != null && propCount < minProperties) {
      errors.add(new ValidationError(path, Keyword.MIN_PROPERTIES, "Too few properties: expected at least " + minProperties));
    }
    if (maxProperties != null && propCount > maxProperties) {
      errors.add(new ValidationError(path, Keyword.MAX_PROPERTIES, "Too many properties: expected at most " + maxProperties));
    }

    // Check required properties, reported at the path the property would occupy
    for (String reqProp : required) {
      if (!obj.has(reqProp)) {
        errors.add(new ValidationError(path.member(reqProp), Keyword.REQUIRED, "Missing required property: " + reqProp));
      }
    }

    // Validate each property with correct precedence
    Iterator<Map.Entry<String, JsonNode>> members = obj.fields();
    while (members.hasNext()) {
      Map.Entry<String, JsonNode> entry = members.next();
      String propName = entry.getKey();
      JsonNode propValue = entry.getValue();
      InstancePath propPath = path.member(propName);

      boolean handled = false;

      // 1. Check if property is in properties
      JsonSchema propSchema = properties.get(propName);
      if (propSchema != null) {
        stack.push(new ValidationFrame(propPath, propSchema, propValue));
        handled = true;
      }

      // 2. Check all patternProperties that match this property name
      for (var patternEntry : patternProperties.entrySet()) {
        if (patternEntry.getKey().matcher(propName).find()) { // unanchored find semantics
          stack.push(new ValidationFrame(propPath, patternEntry.getValue(), propValue));
          handled = true;
        }
      }

      // 3. Anything else falls to additionalProperties
      if (!handled) {
        if (!additionalPropertiesAllowed) {
          errors.add(new ValidationError(propPath, Keyword.ADDITIONAL_PROPERTIES, "Additional property not allowed: " + propName));
        } else if (additionalProperties != null) {
          stack.push(new ValidationFrame(propPath, additionalProperties, propValue));
        }
      }
    }

    return errors.isEmpty() ? ValidationResult.success() : ValidationResult.failure(errors);
  }
}
