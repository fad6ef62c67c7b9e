package io.github.sasproject.json.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;

import java.util.*;

/// Array schema with item validation and constraints
///
/// Draft-04 `items` is either one schema for every element or a tuple of schemas;
/// elements past a tuple are governed by `additionalItems`.
public record ArraySchema(
    JsonSchema items,
    List<JsonSchema> tupleItems,
    JsonSchema additionalItems,
    boolean additionalItemsAllowed,
    Integer minItems,
    Integer maxItems,
    boolean uniqueItems,
    boolean assertType
) implements JsonSchema {

  public ArraySchema {
    tupleItems = tupleItems == null ? null : List.copyOf(tupleItems);
  }

  @Override
  public ValidationResult validateAt(InstancePath path, JsonNode json, Deque<ValidationFrame> stack) {
    if (!(json instanceof ArrayNode)) {
      return assertType
          ? ValidationResult.failure(List.of(new ValidationError(path, Keyword.TYPE, "Expected array")))
          : ValidationResult.success();
    }
    ArrayNode arr = (ArrayNode) json;

    List<ValidationError> errors = new ArrayList<>();
    int itemCount = arr.size();

    // Check item count constraints
    if (minItems != null && itemCount < minItems) {
      errors.add(new ValidationError(path, Keyword.MIN_ITEMS, "Too few items: expected at least " + minItems));
    }
    if (maxItems != null && itemCount > maxItems) {
      errors.add(new ValidationError(path, Keyword.MAX_ITEMS, "Too many items: expected at most " + maxItems));
    }

    // Check uniqueness if required (structural equality, numbers by value)
    if (uniqueItems && !allUnique(arr)) {
      errors.add(new ValidationError(path, Keyword.UNIQUE_ITEMS, "Array items must be unique"));
    }

    if (tupleItems != null) {
      for (int i = 0; i < itemCount; i++) {
        InstancePath itemPath = path.index(i);
        if (i < tupleItems.size()) {
          stack.push(new ValidationFrame(itemPath, tupleItems.get(i), arr.get(i)));
        } else if (!additionalItemsAllowed) {
          errors.add(new ValidationError(itemPath, Keyword.ADDITIONAL_ITEMS, "Additional items not allowed beyond " + tupleItems.size()));
          break;
        } else if (additionalItems != null) {
          stack.push(new ValidationFrame(itemPath, additionalItems, arr.get(i)));
        }
      }
    } else if (items != null && items != AnySchema.INSTANCE) {
      for (int i = 0; i < itemCount; i++) {
        stack.push(new ValidationFrame(path.index(i), items, arr.get(i)));
      }
    }

    return errors.isEmpty() ? ValidationResult.success() : ValidationResult.failure(errors);
  }

  private static boolean allUnique(ArrayNode arr) {
    for (int i = 0; i < arr.size(); i++) {
      for (int j = i + 1; j < arr.size(); j++) {
        if (SchemaJson.jsonEquals(arr.get(i), arr.get(j))) {
          return false;
        }
      }
    }
    return true;
  }
}
